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

package io.nosqlbench.collectionloader.memory;

import io.nosqlbench.collectionloader.operation.CancellationCheck;
import io.nosqlbench.collectionloader.operation.LoadingOperation;
import io.nosqlbench.collectionloader.operation.LoadingOperationDelegate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fetches one page from a {@link PageSource} and upserts its items into a
 * {@link LocalCollection}, calling the loader's delegate around the import.
 */
final class PageImportOperation<P, K, T> extends LoadingOperation<FetchedPage<P, T>> {

    private static final Logger logger = LogManager.getLogger(PageImportOperation.class);

    private final PageSource<P, T> source;
    private final LocalCollection<K, T> collection;
    private final P pageInfo;
    private final long orderDelta;
    private final LoadingOperationDelegate<List<T>> delegate;

    PageImportOperation(PageSource<P, T> source,
                        LocalCollection<K, T> collection,
                        P pageInfo,
                        long orderDelta,
                        LoadingOperationDelegate<List<T>> delegate) {
        this.source = source;
        this.collection = collection;
        this.pageInfo = pageInfo;
        this.orderDelta = orderDelta;
        this.delegate = delegate;
    }

    @Override
    protected FetchedPage<P, T> execute(CancellationCheck check) throws Exception {
        delegate.remoteOperationWillStart(check);
        FetchedPage<P, T> page = Objects.requireNonNull(
            source.fetch(pageInfo, check), "page source returned no page for " + pageInfo);
        check.throwIfCancelled();

        if (!delegate.operationWillImportResults(check)) {
            logger.debug("Import of page {} declined, {} items not stored", pageInfo, page.getItems().size());
            return page;
        }

        List<T> items = page.getItems();
        List<T> imported = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            T item = items.get(i);
            collection.upsert(item, (page.getOffset() + i) * orderDelta);
            imported.add(item);
        }
        logger.trace("Imported {} items of page {} at offset {}", imported.size(), pageInfo, page.getOffset());

        delegate.operationDidFinishImport(Collections.unmodifiableList(imported), check);
        return page;
    }

    @Override
    public String toString() {
        return "PageImportOperation(" + pageInfo + ")";
    }
}
