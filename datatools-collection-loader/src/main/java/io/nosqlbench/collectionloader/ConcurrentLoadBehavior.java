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
 * What to do with a new page load when other loads are current or queued.
 * Cancelling a load only cancels its loading operation: it still completes and its
 * delegate is still told it finished.
 *
 * @see LoadRequestPolicy
 * @since 4.0.0
 */
public enum ConcurrentLoadBehavior {

    /** Queue the new load after all the queued loads. */
    QUEUE,
    /** Cancel all queued loads except the current one, then queue the new load. */
    REPLACE_QUEUE,
    /** Cancel all queued loads and the current one, then queue the new load. */
    CANCEL_ALL_OTHER,

    /** Skip the new load if any load is queued or in progress. */
    SKIP,
    /** Skip the new load if one with the same page info and reason is queued or in progress. */
    SKIP_SAME,
    /** Skip the new load if one for the same reason is queued or in progress. */
    SKIP_SAME_REASON,
    /** Skip the new load if one for the same page info is queued or in progress. */
    SKIP_SAME_PAGE_INFO
}
