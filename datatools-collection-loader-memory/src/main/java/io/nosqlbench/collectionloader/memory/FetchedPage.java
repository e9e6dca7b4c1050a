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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One page as returned by a {@link PageSource}: its items, the position of the first item
 * in the whole remote collection, and the neighbouring pages when the source knows them.
 *
 * @param <P> page info type
 * @param <T> item type
 * @since 4.0.0
 */
public final class FetchedPage<P, T> {

    private final List<T> items;
    private final long offset;
    private final P nextPageInfo;
    private final P previousPageInfo;

    private FetchedPage(List<T> items, long offset, P nextPageInfo, P previousPageInfo) {
        this.items = List.copyOf(Objects.requireNonNull(items, "items"));
        this.offset = offset;
        this.nextPageInfo = nextPageInfo;
        this.previousPageInfo = previousPageInfo;
    }

    /**
     * @param items the items of the page, in remote order
     * @param offset position of the first item in the remote collection; may be negative
     * @param nextPageInfo the following page, or null if this is the last one
     * @param previousPageInfo the preceding page, or null if this is the first one
     */
    public static <P, T> FetchedPage<P, T> of(List<T> items, long offset, P nextPageInfo, P previousPageInfo) {
        return new FetchedPage<>(items, offset, nextPageInfo, previousPageInfo);
    }

    public List<T> getItems() {
        return items;
    }

    public long getOffset() {
        return offset;
    }

    public Optional<P> getNextPageInfo() {
        return Optional.ofNullable(nextPageInfo);
    }

    public Optional<P> getPreviousPageInfo() {
        return Optional.ofNullable(previousPageInfo);
    }

    @Override
    public String toString() {
        return "FetchedPage[offset=" + offset + ", items=" + items.size()
            + ", previous=" + previousPageInfo + ", next=" + nextPageInfo + "]";
    }
}
