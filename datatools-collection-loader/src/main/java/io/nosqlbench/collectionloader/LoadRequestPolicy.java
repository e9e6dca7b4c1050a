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

import java.util.List;
import java.util.Objects;

/**
 * Decides how a new page load is admitted given the loads already in flight.
 * The decision is a pure function of its arguments; applying it (cancelling, queueing)
 * is up to the {@link CollectionLoader}.
 *
 * <table>
 *   <caption>Behaviors</caption>
 *   <tr><th>Behavior</th><th>Action</th></tr>
 *   <tr><td>QUEUE</td><td>{@link Action#ADMIT}</td></tr>
 *   <tr><td>REPLACE_QUEUE</td><td>{@link Action#CANCEL_QUEUED_THEN_ADMIT}</td></tr>
 *   <tr><td>CANCEL_ALL_OTHER</td><td>{@link Action#CANCEL_ALL_THEN_ADMIT}</td></tr>
 *   <tr><td>SKIP*</td><td>{@link Action#SKIP} when a matching load is in flight, else {@link Action#ADMIT}</td></tr>
 * </table>
 *
 * @since 4.0.0
 */
public final class LoadRequestPolicy {

    /**
     * What the loader does with a requested load.
     */
    public enum Action {
        /** Append the load to the queue. */
        ADMIT,
        /** Cancel every queued load (the current one keeps running), then append. */
        CANCEL_QUEUED_THEN_ADMIT,
        /** Cancel every queued load and the current one, then append. */
        CANCEL_ALL_THEN_ADMIT,
        /** Drop the request. No pipeline, no delegate call. */
        SKIP;

        public boolean admits() {
            return this != SKIP;
        }
    }

    private LoadRequestPolicy() {
    }

    /**
     * Decides what to do with a load request.
     *
     * @param behavior the requested concurrent load behavior
     * @param requested the load being requested
     * @param inFlight the current load (if any) followed by the queued loads, in order
     * @param <P> the page info type
     * @return the action to apply
     */
    public static <P> Action decide(ConcurrentLoadBehavior behavior,
                                    PageLoadDescription<P> requested,
                                    List<PageLoadDescription<P>> inFlight) {
        Objects.requireNonNull(behavior, "behavior");
        Objects.requireNonNull(requested, "requested");
        Objects.requireNonNull(inFlight, "inFlight");

        switch (behavior) {
            case QUEUE:
                return Action.ADMIT;
            case REPLACE_QUEUE:
                return Action.CANCEL_QUEUED_THEN_ADMIT;
            case CANCEL_ALL_OTHER:
                return Action.CANCEL_ALL_THEN_ADMIT;
            case SKIP:
                return inFlight.isEmpty() ? Action.ADMIT : Action.SKIP;
            case SKIP_SAME:
                return inFlight.contains(requested) ? Action.SKIP : Action.ADMIT;
            case SKIP_SAME_REASON:
                for (PageLoadDescription<P> load : inFlight) {
                    if (load.getReason() == requested.getReason()) {
                        return Action.SKIP;
                    }
                }
                return Action.ADMIT;
            case SKIP_SAME_PAGE_INFO:
                for (PageLoadDescription<P> load : inFlight) {
                    if (load.getPageInfo().equals(requested.getPageInfo())) {
                        return Action.SKIP;
                    }
                }
                return Action.ADMIT;
            default:
                throw new IllegalArgumentException("Unknown concurrent load behavior: " + behavior);
        }
    }
}
