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
 * Why a page is loaded. The reason decides which page cursors a successful load updates
 * and whether stale local objects are removed on import.
 *
 * @since 4.0.0
 */
public enum LoadReason {
    /**
     * The page loaded when nothing is known yet, or when a full reload is wanted.
     * Not necessarily the first page of a bidirectional collection.
     * Updates both cursors; local objects absent from the page are removed.
     */
    INITIAL_PAGE,

    /** Forward paging. Updates the next cursor only. */
    NEXT_PAGE,

    /** Backward paging. Updates the previous cursor only. */
    PREVIOUS_PAGE,

    /**
     * Bulk reconciliation of a range. Reserved: cursors are left alone and no
     * reconciliation algorithm is applied.
     */
    SYNC
}
