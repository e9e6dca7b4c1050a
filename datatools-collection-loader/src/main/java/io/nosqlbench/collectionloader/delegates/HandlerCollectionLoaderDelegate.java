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

package io.nosqlbench.collectionloader.delegates;

import io.nosqlbench.collectionloader.CollectionLoaderDelegate;
import io.nosqlbench.collectionloader.PageLoadDescription;
import io.nosqlbench.collectionloader.operation.CancellationCheck;
import io.nosqlbench.collectionloader.operation.LoadResult;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A {@link CollectionLoaderDelegate} assembled from individual handlers, for callers who
 * only care about some of the events. Every handler not supplied does nothing (and
 * {@code canDelete} allows every removal).
 *
 * <pre>{@code
 * loader.setDelegate(HandlerCollectionLoaderDelegate.<Integer, Item, List<Item>, Page>builder()
 *     .onWillStartLoading(load -> spinner.show())
 *     .onDidFinishLoading((load, result) -> spinner.hide())
 *     .build());
 * }</pre>
 *
 * @since 4.0.0
 */
public final class HandlerCollectionLoaderDelegate<P, F, R, C> implements CollectionLoaderDelegate<P, F, R, C> {

    /**
     * The pre-completion checkpoint as a functional interface.
     */
    @FunctionalInterface
    public interface WillFinishLoadingHandler<P, R> {
        void willFinishLoading(PageLoadDescription<P> pageLoad, R preCompletionResults, CancellationCheck check)
            throws Exception;
    }

    private final Consumer<PageLoadDescription<P>> willStartLoading;
    private final BiConsumer<PageLoadDescription<P>, LoadResult<C>> didFinishLoading;
    private final Predicate<F> canDelete;
    private final WillFinishLoadingHandler<P, R> willFinishLoading;

    private HandlerCollectionLoaderDelegate(Builder<P, F, R, C> builder) {
        this.willStartLoading = builder.willStartLoading;
        this.didFinishLoading = builder.didFinishLoading;
        this.canDelete = builder.canDelete;
        this.willFinishLoading = builder.willFinishLoading;
    }

    public static <P, F, R, C> Builder<P, F, R, C> builder() {
        return new Builder<>();
    }

    @Override
    public void willStartLoading(PageLoadDescription<P> pageLoad) {
        willStartLoading.accept(pageLoad);
    }

    @Override
    public void didFinishLoading(PageLoadDescription<P> pageLoad, LoadResult<C> results) {
        didFinishLoading.accept(pageLoad, results);
    }

    @Override
    public boolean canDelete(F object) {
        return canDelete.test(object);
    }

    @Override
    public void willFinishLoading(PageLoadDescription<P> pageLoad, R preCompletionResults, CancellationCheck check)
        throws Exception {
        willFinishLoading.willFinishLoading(pageLoad, preCompletionResults, check);
    }

    public static final class Builder<P, F, R, C> {
        private Consumer<PageLoadDescription<P>> willStartLoading = pageLoad -> {
        };
        private BiConsumer<PageLoadDescription<P>, LoadResult<C>> didFinishLoading = (pageLoad, results) -> {
        };
        private Predicate<F> canDelete = object -> true;
        private WillFinishLoadingHandler<P, R> willFinishLoading = (pageLoad, results, check) -> {
        };

        private Builder() {
        }

        public Builder<P, F, R, C> onWillStartLoading(Consumer<PageLoadDescription<P>> handler) {
            this.willStartLoading = Objects.requireNonNull(handler, "handler");
            return this;
        }

        public Builder<P, F, R, C> onDidFinishLoading(BiConsumer<PageLoadDescription<P>, LoadResult<C>> handler) {
            this.didFinishLoading = Objects.requireNonNull(handler, "handler");
            return this;
        }

        public Builder<P, F, R, C> canDelete(Predicate<F> predicate) {
            this.canDelete = Objects.requireNonNull(predicate, "predicate");
            return this;
        }

        public Builder<P, F, R, C> onWillFinishLoading(WillFinishLoadingHandler<P, R> handler) {
            this.willFinishLoading = Objects.requireNonNull(handler, "handler");
            return this;
        }

        public HandlerCollectionLoaderDelegate<P, F, R, C> build() {
            return new HandlerCollectionLoaderDelegate<>(this);
        }
    }
}
