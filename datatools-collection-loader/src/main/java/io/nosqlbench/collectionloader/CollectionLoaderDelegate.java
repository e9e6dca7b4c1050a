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
import io.nosqlbench.collectionloader.operation.LoadResult;

/**
 * Receives the lifecycle events of the page loads of a {@link CollectionLoader}.
 *
 * <p>For every admitted load, {@link #willStartLoading} is called once, then
 * {@link #didFinishLoading} exactly once, whatever the outcome. Loads complete in the
 * order they were admitted. A load whose operation could not be built only gets
 * {@link #didFinishLoading}. Skipped loads get nothing.
 *
 * <p>{@link #willStartLoading} and {@link #didFinishLoading} run on the loader's
 * coordination thread and must not block. {@link #canDelete} and
 * {@link #willFinishLoading} run on the loading thread, during the import.
 *
 * @param <P> page info type
 * @param <F> fetched object type
 * @param <R> pre-completion results type
 * @param <C> completion results type
 * @see io.nosqlbench.collectionloader.delegates.HandlerCollectionLoaderDelegate
 * @see io.nosqlbench.collectionloader.delegates.LoggingCollectionLoaderDelegate
 * @since 4.0.0
 */
public interface CollectionLoaderDelegate<P, F, R, C> {

    void willStartLoading(PageLoadDescription<P> pageLoad);

    void didFinishLoading(PageLoadDescription<P> pageLoad, LoadResult<C> results);

    /**
     * Vetoes the removal of a local object missing from a freshly loaded initial page.
     *
     * @param object a local object the initial page did not contain
     * @return true to let the helper remove it
     */
    default boolean canDelete(F object) {
        return true;
    }

    /**
     * Last checkpoint before a load completes, run after the import.
     * Throwing fails the whole load.
     *
     * @param pageLoad the load being imported
     * @param preCompletionResults the imported objects
     * @param check cancellation checkpoint
     * @throws Exception to fail the load
     */
    default void willFinishLoading(PageLoadDescription<P> pageLoad, R preCompletionResults, CancellationCheck check)
        throws Exception {
    }
}
