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
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The next and previous page infos of a collection, as learned from successful loads.
 * Written only from the loader's coordination thread; readable from any thread.
 *
 * @param <P> the page info type
 * @since 4.0.0
 */
public final class PageCursors<P> {

    private volatile P next;
    private volatile P previous;

    public Optional<P> getNext() {
        return Optional.ofNullable(next);
    }

    public Optional<P> getPrevious() {
        return Optional.ofNullable(previous);
    }

    /**
     * Records a successful load. Only the cursors the reason owns are evaluated and
     * written: both for {@link LoadReason#INITIAL_PAGE}, next for
     * {@link LoadReason#NEXT_PAGE}, previous for {@link LoadReason#PREVIOUS_PAGE},
     * none for {@link LoadReason#SYNC}.
     *
     * @param reason the reason of the load that succeeded
     * @param nextPage derives the next page info from the load results
     * @param previousPage derives the previous page info from the load results
     */
    void recordSuccess(LoadReason reason, Supplier<Optional<P>> nextPage, Supplier<Optional<P>> previousPage) {
        Objects.requireNonNull(reason, "reason");
        switch (reason) {
            case INITIAL_PAGE:
                P initialNext = nextPage.get().orElse(null);
                P initialPrevious = previousPage.get().orElse(null);
                next = initialNext;
                previous = initialPrevious;
                break;
            case NEXT_PAGE:
                next = nextPage.get().orElse(null);
                break;
            case PREVIOUS_PAGE:
                previous = previousPage.get().orElse(null);
                break;
            case SYNC:
                break;
            default:
                throw new IllegalArgumentException("Unknown load reason: " + reason);
        }
    }

    @Override
    public String toString() {
        return "PageCursors[previous=" + previous + ", next=" + next + "]";
    }
}
