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

/**
 * Ordered, race-free loading of paged collections.
 *
 * <p>A {@link io.nosqlbench.collectionloader.CollectionLoader} schedules page loads built by a
 * {@link io.nosqlbench.collectionloader.CollectionLoaderHelper}. Each admitted load becomes a
 * pipeline of three chained steps:
 * <ol>
 *   <li><strong>prestart</strong> on the loader's coordination thread</li>
 *   <li><strong>loading</strong> on the fetch executor</li>
 *   <li><strong>completion</strong> on the coordination thread</li>
 * </ol>
 * Pipelines start one at a time and complete in admission order. What happens to the loads in
 * flight when a new one is requested is chosen per request with a
 * {@link io.nosqlbench.collectionloader.ConcurrentLoadBehavior}.
 *
 * <h2>Getting Started</h2>
 * <pre>{@code
 * try (CollectionLoader<Integer, Item, List<Item>, Page> loader = CollectionLoaders.forHelper(helper)
 *         .withDelegate(delegate)
 *         .build()) {
 *     loader.loadInitialPage();
 *     loader.loadNextPage();   // skipped if a next page load is already in flight
 *     loader.whenIdle().join();
 * }
 * }</pre>
 *
 * <h2>Key Types</h2>
 * <ul>
 *   <li>{@link io.nosqlbench.collectionloader.CollectionLoaderHelper} - builds operations and
 *       gives access to the local collection</li>
 *   <li>{@link io.nosqlbench.collectionloader.CollectionLoaderDelegate} - lifecycle callbacks,
 *       see also {@link io.nosqlbench.collectionloader.delegates}</li>
 *   <li>{@link io.nosqlbench.collectionloader.operation.LoadingOperation} - one cancellable fetch</li>
 *   <li>{@link io.nosqlbench.collectionloader.CollectionLoaderConfig} - JSON configuration</li>
 *   <li>{@link io.nosqlbench.collectionloader.LoadStatistics} - counters per loader</li>
 * </ul>
 *
 * @since 4.0.0
 */
package io.nosqlbench.collectionloader;
