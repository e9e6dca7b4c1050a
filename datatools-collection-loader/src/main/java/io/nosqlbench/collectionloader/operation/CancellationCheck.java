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

package io.nosqlbench.collectionloader.operation;

/**
 * A checkpoint handed to cooperative loading code. Long-running fetch and import work
 * calls {@link #throwIfCancelled()} at safe points so that a cancelled page load
 * stops promptly.
 *
 * @see LoadingOperation#throwIfCancelled()
 * @since 4.0.0
 */
@FunctionalInterface
public interface CancellationCheck {

    /**
     * Returns normally when the owning operation is still wanted.
     *
     * @throws LoadCancelledException if the owning operation was cancelled
     */
    void throwIfCancelled() throws LoadCancelledException;

    /**
     * A check that never trips, for code run outside any operation.
     *
     * @return a no-op cancellation check
     */
    static CancellationCheck never() {
        return () -> {
        };
    }
}
