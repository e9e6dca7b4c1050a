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

/**
 * Lifecycle of one admitted page load.
 *
 * <p>State Transitions:
 * <ul>
 *   <li><strong>QUEUED → CURRENT:</strong> the load's prestart ran on the coordination thread</li>
 *   <li><strong>CURRENT → SUCCEEDED:</strong> the completion saw a successful result</li>
 *   <li><strong>CURRENT → FAILED:</strong> the completion saw a failure</li>
 *   <li><strong>CURRENT → CANCELLED:</strong> the completion saw a cancellation failure</li>
 * </ul>
 *
 * <p>No load skips {@link #CURRENT}. A load whose operation could not even be built never
 * gets a pipeline, and so has no state at all.
 *
 * @since 4.0.0
 */
public enum PipelineState {
    /** Admitted, waiting for the previous load to complete. */
    QUEUED("⏳"),

    /** The one load in progress. */
    CURRENT("🔄"),

    /** Completed with a successful result (terminal state). */
    SUCCEEDED("✅"),

    /** Completed with a failure (terminal state). */
    FAILED("❌"),

    /** Completed after its operation was cancelled (terminal state). */
    CANCELLED("🚫");

    private final String glyph;

    PipelineState(String glyph) {
        this.glyph = glyph;
    }

    /**
     * @return a Unicode emoji character representing this state, for log lines
     */
    public String getGlyph() {
        return glyph;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
