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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters about the page loads of one {@link CollectionLoader}.
 *
 * <h2>Counted events</h2>
 * <ul>
 *   <li><strong>Requested:</strong> every call reaching the load policy</li>
 *   <li><strong>Skipped:</strong> requests dropped by a skip behavior</li>
 *   <li><strong>Construction failed:</strong> requests whose helper could not build an operation</li>
 *   <li><strong>Admitted:</strong> requests that became a pipeline</li>
 *   <li><strong>Succeeded / Failed / Cancelled:</strong> completed pipelines, by outcome</li>
 *   <li><strong>Pending:</strong> admitted but not yet completed</li>
 * </ul>
 *
 * @since 4.0.0
 */
public final class LoadStatistics {
    private final AtomicLong requested = new AtomicLong(0);
    private final AtomicLong skipped = new AtomicLong(0);
    private final AtomicLong constructionFailed = new AtomicLong(0);
    private final AtomicLong admitted = new AtomicLong(0);
    private final AtomicLong succeeded = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);
    private final AtomicLong cancelled = new AtomicLong(0);

    public long getRequested() {
        return requested.get();
    }

    public long getSkipped() {
        return skipped.get();
    }

    public long getConstructionFailed() {
        return constructionFailed.get();
    }

    public long getAdmitted() {
        return admitted.get();
    }

    public long getSucceeded() {
        return succeeded.get();
    }

    public long getFailed() {
        return failed.get();
    }

    public long getCancelled() {
        return cancelled.get();
    }

    /**
     * Calculated as: admitted - (succeeded + failed + cancelled).
     *
     * @return the number of admitted loads not completed yet
     */
    public long getPending() {
        return admitted.get() - succeeded.get() - failed.get() - cancelled.get();
    }

    /**
     * @return true if no admitted load is pending
     */
    public boolean isIdle() {
        return getPending() == 0;
    }

    // Package-private methods for updating statistics

    void incrementRequested() {
        requested.incrementAndGet();
    }

    void incrementSkipped() {
        skipped.incrementAndGet();
    }

    void incrementConstructionFailed() {
        constructionFailed.incrementAndGet();
    }

    void incrementAdmitted() {
        admitted.incrementAndGet();
    }

    void recordCompletion(PipelineState state) {
        switch (state) {
            case SUCCEEDED:
                succeeded.incrementAndGet();
                break;
            case FAILED:
                failed.incrementAndGet();
                break;
            case CANCELLED:
                cancelled.incrementAndGet();
                break;
            default:
                throw new IllegalArgumentException("Not a terminal state: " + state);
        }
    }

    @Override
    public String toString() {
        return String.format(
            "LoadStatistics[requested=%d, skipped=%d, constructionFailed=%d, admitted=%d, succeeded=%d, failed=%d, cancelled=%d, pending=%d]",
            getRequested(), getSkipped(), getConstructionFailed(), getAdmitted(),
            getSucceeded(), getFailed(), getCancelled(), getPending()
        );
    }
}
