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
 * Ready-made {@link io.nosqlbench.collectionloader.CollectionLoaderDelegate} implementations.
 *
 * <ul>
 *   <li>{@link io.nosqlbench.collectionloader.delegates.HandlerCollectionLoaderDelegate} -
 *       assembled from lambdas, one per event</li>
 *   <li>{@link io.nosqlbench.collectionloader.delegates.LoggingCollectionLoaderDelegate} -
 *       logs each event through Log4j 2 and forwards it</li>
 * </ul>
 */
package io.nosqlbench.collectionloader.delegates;
