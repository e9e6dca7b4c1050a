/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.collectionloader;

import io.nosqlbench.collectionloader.operation.CancellationCheck;
import io.nosqlbench.collectionloader.operation.LoadingOperationDelegate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The {@link LoadingOperationDelegate} a {@link CollectionLoader} hands to every operation
 * it requests. After an initial page is imported it removes the local objects the page no
 * longer contains, then gives the loader's delegate its pre-completion checkpoint.
 *
 * <p>Runs on the loading thread. Holds the helper and delegate captured when the load was
 * admitted.
 */
final class PageImportDelegate<P, F, R, C> implements LoadingOperationDelegate<R> {

    private static final Logger logger = LogManager.getLogger(PageImportDelegate.class);

    private final CollectionLoaderHelper<P, F, R, C> helper;
    private final PageLoadDescription<P> pageLoad;
    private final CollectionLoaderDelegate<P, F, R, C> delegate;

    PageImportDelegate(CollectionLoaderHelper<P, F, R, C> helper,
                       PageLoadDescription<P> pageLoad,
                       CollectionLoaderDelegate<P, F, R, C> delegate) {
        this.helper = helper;
        this.pageLoad = pageLoad;
        this.delegate = delegate;
    }

    @Override
    public void remoteOperationWillStart(CancellationCheck check) throws Exception {
        check.throwIfCancelled();
    }

    @Override
    public boolean operationWillImportResults(CancellationCheck check) throws Exception {
        return true;
    }

    @Override
    public void operationDidFinishImport(R results, CancellationCheck check) throws Exception {
        switch (pageLoad.getReason()) {
            case INITIAL_PAGE:
                removeObjectsMissingFrom(results, check);
                break;
            case NEXT_PAGE:
            case PREVIOUS_PAGE:
                break;
            case SYNC:
                logger.debug("No reconciliation is defined for {}; imported objects are kept as is", pageLoad);
                break;
            default:
                throw new IllegalArgumentException("Unknown load reason: " + pageLoad.getReason());
        }
        if (delegate != null) {
            delegate.willFinishLoading(pageLoad, results, check);
        }
    }

    private void removeObjectsMissingFrom(R results, CancellationCheck check) throws Exception {
        int importedCount = helper.numberOfObjects(results);
        Set<F> kept = new HashSet<>(importedCount * 2);
        for (int i = 0; i < importedCount; i++) {
            kept.add(helper.objectAt(i, results));
        }

        List<F> stale = new ArrayList<>();
        for (F object : helper.localObjects()) {
            if (!kept.contains(object) && (delegate == null || delegate.canDelete(object))) {
                stale.add(object);
            }
        }

        for (F object : stale) {
            check.throwIfCancelled();
            helper.delete(object);
        }
        if (!stale.isEmpty()) {
            logger.debug("Removed {} local objects missing from {}", stale.size(), pageLoad);
        }
    }
}
