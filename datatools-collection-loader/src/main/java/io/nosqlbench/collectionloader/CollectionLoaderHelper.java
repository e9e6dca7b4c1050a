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

import io.nosqlbench.collectionloader.operation.LoadResult;
import io.nosqlbench.collectionloader.operation.LoadingOperation;
import io.nosqlbench.collectionloader.operation.LoadingOperationDelegate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The storage- or transport-specific half of a {@link CollectionLoader}. The loader never
 * loads anything itself: it asks its helper for {@link LoadingOperation}s and derives the
 * page cursors from their results through the helper.
 *
 * <p>The helper also exposes the objects currently held locally, so that loading the
 * initial page can remove the ones the page no longer contains.
 *
 * <p>Methods marked as running on the loading thread may be called concurrently with the
 * coordination thread; the loader never runs two loading operations at once.
 *
 * @param <P> page info type; must implement value equality
 * @param <F> type of the fetched (locally held) objects
 * @param <R> pre-completion results: what an import produced
 * @param <C> completion results: what a finished operation reports
 * @since 4.0.0
 */
public interface CollectionLoaderHelper<P, F, R, C> {

    /**
     * @return the page info to load when no page is known, or for a full reload
     */
    P initialPageInfo();

    /**
     * Builds, but does not start, the operation loading a page. The operation must call the
     * given delegate at the points its contract describes.
     *
     * @param pageInfo the page to load
     * @param delegate the loader's callbacks for this operation
     * @return a fresh operation
     * @throws Exception if no operation can be built for this page
     */
    LoadingOperation<C> operationForLoading(P pageInfo, LoadingOperationDelegate<R> delegate) throws Exception;

    /**
     * Extracts the results of a finished operation. Called on the coordination thread.
     *
     * @param finishedOperation an operation built by this helper that has finished
     * @return the results of the operation
     */
    default LoadResult<C> results(LoadingOperation<C> finishedOperation) {
        return finishedOperation.getResult();
    }

    /**
     * @param completionResults results of a successful load
     * @param from the page info that was loaded
     * @return the page after the loaded one, if any
     */
    Optional<P> nextPageInfo(C completionResults, P from);

    /**
     * @param completionResults results of a successful load
     * @param from the page info that was loaded
     * @return the page before the loaded one, if any
     */
    Optional<P> previousPageInfo(C completionResults, P from);

    /* Local objects; called on the loading thread. */

    /**
     * @return the number of objects currently held locally for the collection
     */
    int numberOfObjects();

    /**
     * @param index index in {@code [0, numberOfObjects())}
     * @return the local object at index
     */
    F objectAt(int index);

    /**
     * Copies the local objects, in order. The default reads {@link #numberOfObjects()} and
     * {@link #objectAt(int)}; helpers whose collection may change concurrently should return
     * a consistent snapshot instead.
     *
     * @return the objects currently held locally
     */
    default List<F> localObjects() {
        int count = numberOfObjects();
        List<F> objects = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            objects.add(objectAt(i));
        }
        return objects;
    }

    /**
     * @param preCompletionResults the objects an import produced
     * @return how many objects the import produced
     */
    int numberOfObjects(R preCompletionResults);

    /**
     * @param index index in {@code [0, numberOfObjects(preCompletionResults))}
     * @param preCompletionResults the objects an import produced
     * @return the imported object at index
     */
    F objectAt(int index, R preCompletionResults);

    /**
     * Removes an object from the local collection. What removal means (deleting the
     * object, or only unlinking it from the collection) is up to the helper.
     *
     * @param object a local object
     */
    void delete(F object);
}
