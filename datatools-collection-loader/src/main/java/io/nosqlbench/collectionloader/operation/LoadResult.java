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

import java.util.Objects;
import java.util.function.Function;

/**
 * The outcome of one page load: either a success carrying the helper's completion
 * results (which may legitimately be {@code null}), or a failure carrying the error.
 * Cancellation is a failure whose error is a {@link LoadCancelledException}.
 *
 * <p>Instances are immutable.
 *
 * @param <C> the completion results type of the helper
 * @since 4.0.0
 */
public final class LoadResult<C> {

    private final C value;
    private final Throwable error;

    private LoadResult(C value, Throwable error) {
        this.value = value;
        this.error = error;
    }

    public static <C> LoadResult<C> success(C value) {
        return new LoadResult<>(value, null);
    }

    public static <C> LoadResult<C> failure(Throwable error) {
        return new LoadResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @return true if this is a failure caused by cancellation
     */
    public boolean isCancelled() {
        return error instanceof LoadCancelledException;
    }

    /**
     * Returns the completion results of a successful load.
     *
     * @return the value, possibly null
     * @throws IllegalStateException if this result is a failure; the failure is attached as cause
     */
    public C getValue() {
        if (error != null) {
            throw new IllegalStateException("page load failed", error);
        }
        return value;
    }

    /**
     * @return the failure, or null for a successful load
     */
    public Throwable getError() {
        return error;
    }

    /**
     * Maps the value of a success, passing failures through untouched.
     *
     * @param mapper the value mapping
     * @param <U> the mapped value type
     * @return a new result
     */
    public <U> LoadResult<U> map(Function<? super C, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LoadResult)) {
            return false;
        }
        LoadResult<?> that = (LoadResult<?>) o;
        return Objects.equals(value, that.value) && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        if (error == null) {
            return "LoadResult[success: " + value + "]";
        }
        return "LoadResult[" + (isCancelled() ? "cancelled" : "failure") + ": " + error + "]";
    }
}
