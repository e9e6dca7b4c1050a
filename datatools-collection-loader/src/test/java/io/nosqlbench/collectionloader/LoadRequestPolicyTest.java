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

import org.junit.jupiter.api.Test;

import java.util.List;

import static io.nosqlbench.collectionloader.LoadRequestPolicy.Action;
import static org.junit.jupiter.api.Assertions.*;

class LoadRequestPolicyTest {

    private static final PageLoadDescription<String> NEXT_A = PageLoadDescription.of("a", LoadReason.NEXT_PAGE);
    private static final PageLoadDescription<String> NEXT_B = PageLoadDescription.of("b", LoadReason.NEXT_PAGE);
    private static final PageLoadDescription<String> PREVIOUS_A = PageLoadDescription.of("a", LoadReason.PREVIOUS_PAGE);
    private static final PageLoadDescription<String> INITIAL_C = PageLoadDescription.of("c", LoadReason.INITIAL_PAGE);

    @Test
    void behaviorsThatNeverSkip() {
        List<PageLoadDescription<String>> inFlight = List.of(NEXT_A, PREVIOUS_A);
        assertEquals(Action.ADMIT, LoadRequestPolicy.decide(ConcurrentLoadBehavior.QUEUE, NEXT_A, inFlight));
        assertEquals(Action.CANCEL_QUEUED_THEN_ADMIT,
            LoadRequestPolicy.decide(ConcurrentLoadBehavior.REPLACE_QUEUE, NEXT_A, inFlight));
        assertEquals(Action.CANCEL_ALL_THEN_ADMIT,
            LoadRequestPolicy.decide(ConcurrentLoadBehavior.CANCEL_ALL_OTHER, INITIAL_C, inFlight));
    }

    @Test
    void skipOnlyWhenSomethingIsInFlight() {
        assertEquals(Action.ADMIT, LoadRequestPolicy.decide(ConcurrentLoadBehavior.SKIP, NEXT_A, List.of()));
        assertEquals(Action.SKIP, LoadRequestPolicy.decide(ConcurrentLoadBehavior.SKIP, NEXT_A, List.of(INITIAL_C)));
    }

    @Test
    void skipSameComparesReasonAndPageInfo() {
        assertEquals(Action.SKIP, LoadRequestPolicy.decide(ConcurrentLoadBehavior.SKIP_SAME,
            PageLoadDescription.of("a", LoadReason.NEXT_PAGE), List.of(INITIAL_C, NEXT_A)));
        assertEquals(Action.ADMIT, LoadRequestPolicy.decide(ConcurrentLoadBehavior.SKIP_SAME, NEXT_A, List.of(PREVIOUS_A)));
        assertEquals(Action.ADMIT, LoadRequestPolicy.decide(ConcurrentLoadBehavior.SKIP_SAME, NEXT_A, List.of(NEXT_B)));
    }

    @Test
    void skipSameReasonIgnoresPageInfo() {
        assertEquals(Action.SKIP, LoadRequestPolicy.decide(ConcurrentLoadBehavior.SKIP_SAME_REASON, NEXT_A, List.of(NEXT_B)));
        assertEquals(Action.ADMIT, LoadRequestPolicy.decide(ConcurrentLoadBehavior.SKIP_SAME_REASON, NEXT_A, List.of(PREVIOUS_A)));
    }

    @Test
    void skipSamePageInfoIgnoresReason() {
        assertEquals(Action.SKIP, LoadRequestPolicy.decide(ConcurrentLoadBehavior.SKIP_SAME_PAGE_INFO, NEXT_A, List.of(PREVIOUS_A)));
        assertEquals(Action.ADMIT, LoadRequestPolicy.decide(ConcurrentLoadBehavior.SKIP_SAME_PAGE_INFO, NEXT_A, List.of(NEXT_B)));
    }

    @Test
    void onlySkipDoesNotAdmit() {
        for (Action action : Action.values()) {
            assertEquals(action != Action.SKIP, action.admits(), action.name());
        }
    }
}
