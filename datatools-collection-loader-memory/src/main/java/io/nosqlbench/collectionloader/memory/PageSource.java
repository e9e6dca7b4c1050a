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

/**
 * The remote side of a {@link LocalCollectionLoaderHelper}: fetches one page of items.
 *
 * @param <P> page info type
 * @param <T> item type
 * @since 4.0.0
 */
@FunctionalInterface
public interface PageSource<P, T> {

    /**
     * Fetches a page. Called on the loading thread. Long-running implementations should
     * call the check between steps.
     *
     * @param pageInfo the page to fetch
     * @param check cancellation checkpoint
     * @return the fetched page, never null
     * @throws Exception any fetch failure; it fails the page load
     */
    FetchedPage<P, T> fetch(P pageInfo, CancellationCheck check) throws Exception;
}
