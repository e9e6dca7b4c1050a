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

import io.nosqlbench.collectionloader.CollectionLoaderHelper;
import io.nosqlbench.collectionloader.operation.LoadingOperation;
import io.nosqlbench.collectionloader.operation.LoadingOperationDelegate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@link CollectionLoaderHelper} importing the pages of a {@link PageSource} into a
 * {@link LocalCollection}.
 *
 * <p>The item at position {@code offset + i} of the remote collection is stored with order
 * {@code (offset + i) * orderDelta}. An order delta above 1 leaves room to insert local
 * items between remote ones.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * LocalCollection<String, Item> items = new LocalCollection<>(Item::getId);
 * LocalCollectionLoaderHelper<Integer, String, Item> helper =
 *     new LocalCollectionLoaderHelper<>(api::fetchPage, items, 0, 10);
 * CollectionLoader<Integer, Item, List<Item>, FetchedPage<Integer, Item>> loader =
 *     CollectionLoaders.forHelper(helper).build();
 * }</pre>
 *
 * @param <P> page info type
 * @param <K> item key type
 * @param <T> item type
 * @since 4.0.0
 */
public class LocalCollectionLoaderHelper<P, K, T> implements CollectionLoaderHelper<P, T, List<T>, FetchedPage<P, T>> {

    private final PageSource<P, T> source;
    private final LocalCollection<K, T> collection;
    private final P initialPageInfo;
    private final long orderDelta;

    public LocalCollectionLoaderHelper(PageSource<P, T> source, LocalCollection<K, T> collection, P initialPageInfo) {
        this(source, collection, initialPageInfo, 1);
    }

    /**
     * @param source fetches the remote pages
     * @param collection receives the imported items
     * @param initialPageInfo the page loaded by an initial page load
     * @param orderDelta spacing of the order values of consecutive remote items; positive
     */
    public LocalCollectionLoaderHelper(PageSource<P, T> source,
                                       LocalCollection<K, T> collection,
                                       P initialPageInfo,
                                       long orderDelta) {
        if (orderDelta <= 0) {
            throw new IllegalArgumentException("orderDelta must be positive, got " + orderDelta);
        }
        this.source = Objects.requireNonNull(source, "source");
        this.collection = Objects.requireNonNull(collection, "collection");
        this.initialPageInfo = Objects.requireNonNull(initialPageInfo, "initialPageInfo");
        this.orderDelta = orderDelta;
    }

    public LocalCollection<K, T> getCollection() {
        return collection;
    }

    public long getOrderDelta() {
        return orderDelta;
    }

    @Override
    public P initialPageInfo() {
        return initialPageInfo;
    }

    @Override
    public LoadingOperation<FetchedPage<P, T>> operationForLoading(P pageInfo, LoadingOperationDelegate<List<T>> delegate) {
        Objects.requireNonNull(pageInfo, "pageInfo");
        return new PageImportOperation<>(source, collection, pageInfo, orderDelta, delegate);
    }

    @Override
    public Optional<P> nextPageInfo(FetchedPage<P, T> completionResults, P from) {
        return completionResults.getNextPageInfo();
    }

    @Override
    public Optional<P> previousPageInfo(FetchedPage<P, T> completionResults, P from) {
        return completionResults.getPreviousPageInfo();
    }

    @Override
    public int numberOfObjects() {
        return collection.size();
    }

    @Override
    public T objectAt(int index) {
        return collection.itemAt(index);
    }

    @Override
    public List<T> localObjects() {
        return collection.snapshot();
    }

    @Override
    public int numberOfObjects(List<T> preCompletionResults) {
        return preCompletionResults.size();
    }

    @Override
    public T objectAt(int index, List<T> preCompletionResults) {
        return preCompletionResults.get(index);
    }

    @Override
    public void delete(T object) {
        collection.remove(object);
    }
}
