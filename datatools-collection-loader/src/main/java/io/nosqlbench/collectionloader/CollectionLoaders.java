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

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory class for creating {@link CollectionLoader} instances.
 *
 * <h2>Usage Examples</h2>
 *
 * <h3>Defaults</h3>
 * <pre>{@code
 * CollectionLoader<Integer, Item, List<Item>, Page> loader = CollectionLoaders.forHelper(helper)
 *     .withDelegate(delegate)
 *     .build();
 * }</pre>
 *
 * <h3>Configured, with a shared fetch pool</h3>
 * <pre>{@code
 * ExecutorService fetchPool = Executors.newFixedThreadPool(4);
 * CollectionLoader<Integer, Item, List<Item>, Page> loader = CollectionLoaders.forHelper(helper)
 *     .withConfig(CollectionLoaderConfig.loadFromResource("collection-loader.json"))
 *     .withFetchExecutor(fetchPool)   // not shut down by the loader
 *     .build();
 * }</pre>
 *
 * @see CollectionLoader
 * @see CollectionLoaderConfig
 * @since 4.0.0
 */
public final class CollectionLoaders {

    private CollectionLoaders() {
    }

    /**
     * Creates a builder for a loader driven by the given helper.
     *
     * @param helper the helper building loading operations
     * @param <P> page info type
     * @param <F> fetched object type
     * @param <R> pre-completion results type
     * @param <C> completion results type
     * @return a builder
     * @throws NullPointerException if helper is null
     */
    public static <P, F, R, C> Builder<P, F, R, C> forHelper(CollectionLoaderHelper<P, F, R, C> helper) {
        return new Builder<>(helper);
    }

    /**
     * Builder for configuring and creating {@link CollectionLoader} instances.
     */
    public static final class Builder<P, F, R, C> {
        private final CollectionLoaderHelper<P, F, R, C> helper;
        private CollectionLoaderConfig config = CollectionLoaderConfig.defaults();
        private ExecutorService fetchExecutor;
        private CollectionLoaderDelegate<P, F, R, C> delegate;

        Builder(CollectionLoaderHelper<P, F, R, C> helper) {
            this.helper = Objects.requireNonNull(helper, "helper");
        }

        public Builder<P, F, R, C> withConfig(CollectionLoaderConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /**
         * Runs loading operations on the given executor instead of a pool created from the
         * configuration. The loader does not shut a provided executor down.
         *
         * @param fetchExecutor the executor for loading operations
         * @return this builder
         */
        public Builder<P, F, R, C> withFetchExecutor(ExecutorService fetchExecutor) {
            this.fetchExecutor = Objects.requireNonNull(fetchExecutor, "fetchExecutor");
            return this;
        }

        public Builder<P, F, R, C> withDelegate(CollectionLoaderDelegate<P, F, R, C> delegate) {
            this.delegate = delegate;
            return this;
        }

        public CollectionLoader<P, F, R, C> build() {
            if (fetchExecutor != null) {
                return new CollectionLoader<>(helper, config, fetchExecutor, false, delegate);
            }
            return new CollectionLoader<>(helper, config, createFetchExecutor(config), true, delegate);
        }

        private static ExecutorService createFetchExecutor(CollectionLoaderConfig config) {
            ThreadFactory threadFactory = new FetchThreadFactory(config.getFetchThreadPrefix());
            int threads = config.getFetchThreads();
            if (threads == 0) {
                return Executors.newCachedThreadPool(threadFactory);
            }
            return Executors.newFixedThreadPool(threads, threadFactory);
        }
    }

    private static final class FetchThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        FetchThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
