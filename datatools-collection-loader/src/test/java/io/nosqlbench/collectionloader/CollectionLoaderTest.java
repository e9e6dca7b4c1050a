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

import io.nosqlbench.collectionloader.delegates.HandlerCollectionLoaderDelegate;
import io.nosqlbench.collectionloader.operation.LoadResult;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class CollectionLoaderTest {

    private static CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> newLoader(
        ScriptedHelper helper, RecordingDelegate delegate) {
        return CollectionLoaders.forHelper(helper)
            .withConfig(CollectionLoaderConfig.defaults()
                .setFetchThreads(4)
                .setCoordinatorThreadName("test-coordinator")
                .setLifecycleLogLevel(Level.INFO))
            .withDelegate(delegate)
            .build();
    }

    private static void awaitIdle(CollectionLoader<?, ?, ?, ?> loader) throws Exception {
        loader.whenIdle().get(10, TimeUnit.SECONDS);
    }

    private static void waitFor(BooleanSupplier condition, String description) {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + description);
            }
            sleepMillis(5);
        }
    }

    private static void sleepMillis(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        }
    }

    @Test
    void completesInSubmissionOrderWhateverTheFetchLatency() throws Exception {
        ScriptedHelper helper = new ScriptedHelper();
        for (int i = 1; i <= 5; i++) {
            helper.page(i, i + 1, null, "item-" + i).latency(i, (5 - i) * 40L);
        }
        RecordingDelegate delegate = new RecordingDelegate();

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader = newLoader(helper, delegate)) {
            for (int i = 1; i <= 5; i++) {
                loader.load(PageLoadDescription.of(i, LoadReason.NEXT_PAGE));
            }
            awaitIdle(loader);

            List<String> expected = new ArrayList<>();
            for (int i = 1; i <= 5; i++) {
                expected.add("start NEXT_PAGE(" + i + ")");
                expected.add("import NEXT_PAGE(" + i + ") 1");
                expected.add("finish NEXT_PAGE(" + i + ") SUCCESS");
            }
            assertEquals(expected, delegate.snapshot());
            assertEquals(1, delegate.getMaxActive(), "only one load may be current at a time");

            LoadStatistics stats = loader.getStatistics();
            assertEquals(5, stats.getRequested());
            assertEquals(5, stats.getAdmitted());
            assertEquals(5, stats.getSucceeded());
            assertTrue(stats.isIdle());
        }
    }

    @Test
    void skipDropsTheRequestWithoutDelegateCalls() throws Exception {
        ScriptedHelper helper = new ScriptedHelper().page(1, null, null, "a").gate(1);
        RecordingDelegate delegate = new RecordingDelegate();

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader = newLoader(helper, delegate)) {
            loader.load(PageLoadDescription.of(1, LoadReason.NEXT_PAGE));
            waitFor(() -> delegate.events.contains("start NEXT_PAGE(1)"), "page 1 to start");
            assertEquals(Optional.of(PageLoadDescription.of(1, LoadReason.NEXT_PAGE)), loader.getCurrentPageLoad());

            loader.load(PageLoadDescription.of(2, LoadReason.SYNC), ConcurrentLoadBehavior.SKIP);
            helper.release(1);
            awaitIdle(loader);

            assertEquals(0, helper.operationsCreatedFor(2));
            for (String event : delegate.snapshot()) {
                assertFalse(event.contains("SYNC(2)"), "unexpected event for a skipped load: " + event);
            }
            assertEquals(1, loader.getStatistics().getSkipped());
            assertEquals(Optional.empty(), loader.getCurrentPageLoad());
        }
    }

    @Test
    void backToBackNextPageRequestsCreateOneOperation() throws Exception {
        ScriptedHelper helper = new ScriptedHelper()
            .page(1, 2, null, "a")
            .page(2, 3, null, "b")
            .gate(2);
        RecordingDelegate delegate = new RecordingDelegate();

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader = newLoader(helper, delegate)) {
            loader.loadInitialPage();
            awaitIdle(loader);

            loader.loadNextPage();
            loader.loadNextPage();
            helper.release(2);
            awaitIdle(loader);

            assertEquals(1, helper.operationsCreatedFor(2));
            assertEquals(1, loader.getStatistics().getSkipped());
            assertEquals(Optional.of(3), loader.getNextPageInfo());
        }
    }

    @Test
    void initialPageCancelsEverythingInFlight() throws Exception {
        ScriptedHelper helper = new ScriptedHelper()
            .page(1, 2, null, "a")
            .gate(5);
        RecordingDelegate delegate = new RecordingDelegate();

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader = newLoader(helper, delegate)) {
            loader.load(PageLoadDescription.of(5, LoadReason.NEXT_PAGE));
            loader.load(PageLoadDescription.of(6, LoadReason.NEXT_PAGE));
            loader.load(PageLoadDescription.of(7, LoadReason.PREVIOUS_PAGE));
            loader.loadInitialPage();
            awaitIdle(loader);

            assertEquals(List.of(
                "finish NEXT_PAGE(5) CANCELLED",
                "finish NEXT_PAGE(6) CANCELLED",
                "finish PREVIOUS_PAGE(7) CANCELLED",
                "finish INITIAL_PAGE(1) SUCCESS"), delegate.finishEvents());

            LoadStatistics stats = loader.getStatistics();
            assertEquals(3, stats.getCancelled());
            assertEquals(1, stats.getSucceeded());
            assertEquals(Optional.of(2), loader.getNextPageInfo());
        }
    }

    @Test
    void replaceQueueKeepsTheCurrentLoad() throws Exception {
        ScriptedHelper helper = new ScriptedHelper().gate(1);
        RecordingDelegate delegate = new RecordingDelegate();

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader = newLoader(helper, delegate)) {
            loader.load(PageLoadDescription.of(1, LoadReason.NEXT_PAGE));
            waitFor(() -> delegate.events.contains("start NEXT_PAGE(1)"), "page 1 to start");
            loader.load(PageLoadDescription.of(2, LoadReason.NEXT_PAGE));
            loader.load(PageLoadDescription.of(3, LoadReason.NEXT_PAGE), ConcurrentLoadBehavior.REPLACE_QUEUE);
            helper.release(1);
            awaitIdle(loader);

            assertEquals(List.of(
                "finish NEXT_PAGE(1) SUCCESS",
                "finish NEXT_PAGE(2) CANCELLED",
                "finish NEXT_PAGE(3) SUCCESS"), delegate.finishEvents());
        }
    }

    @Test
    void cursorsFollowTheReasonOfEachSuccessfulLoad() throws Exception {
        ScriptedHelper helper = new ScriptedHelper()
            .page(1, 11, 12, "a")
            .page(11, 13, 99, "b");
        RecordingDelegate delegate = new RecordingDelegate();

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader = newLoader(helper, delegate)) {
            assertEquals(Optional.empty(), loader.getNextPageInfo());
            assertEquals(Optional.empty(), loader.getPreviousPageInfo());

            loader.loadInitialPage();
            awaitIdle(loader);
            assertEquals(Optional.of(11), loader.getNextPageInfo());
            assertEquals(Optional.of(12), loader.getPreviousPageInfo());

            loader.loadNextPage();
            awaitIdle(loader);
            assertEquals(Optional.of(13), loader.getNextPageInfo());
            assertEquals(Optional.of(12), loader.getPreviousPageInfo(), "a next page load leaves previous alone");
        }
    }

    @Test
    void nextPageDoesNothingWithoutANextCursor() throws Exception {
        ScriptedHelper helper = new ScriptedHelper().page(1, null, null, "a");
        RecordingDelegate delegate = new RecordingDelegate();

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader = newLoader(helper, delegate)) {
            loader.loadNextPage();
            loader.loadPreviousPage();
            awaitIdle(loader);

            assertTrue(delegate.snapshot().isEmpty());
            assertEquals(0, loader.getStatistics().getRequested());
        }
    }

    @Test
    void constructionFailureIsReportedOnceAndNothingIsQueued() throws Exception {
        ScriptedHelper helper = new ScriptedHelper().failConstruction(9);
        RecordingDelegate delegate = new RecordingDelegate();

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader = newLoader(helper, delegate)) {
            PageLoadDescription<Integer> pageLoad = PageLoadDescription.of(9, LoadReason.SYNC);
            loader.load(pageLoad);
            awaitIdle(loader);

            assertEquals(List.of("finish SYNC(9) FAILED"), delegate.snapshot());
            LoadResult<ScriptedHelper.Page> result = delegate.results.get(0);
            LoadConstructionException error = assertInstanceOf(LoadConstructionException.class, result.getError());
            assertEquals(pageLoad, error.getPageLoad());
            assertInstanceOf(IOException.class, error.getCause());

            LoadStatistics stats = loader.getStatistics();
            assertEquals(1, stats.getConstructionFailed());
            assertEquals(0, stats.getAdmitted());
            assertEquals(Optional.empty(), loader.getCurrentPageLoad());
        }
    }

    @Test
    void cancelAllOnAnIdleLoaderIsANoOp() throws Exception {
        ScriptedHelper helper = new ScriptedHelper().page(1, null, null, "a");
        RecordingDelegate delegate = new RecordingDelegate();

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader = newLoader(helper, delegate)) {
            loader.cancelAllLoadings();
            awaitIdle(loader);
            assertTrue(delegate.snapshot().isEmpty());

            loader.loadInitialPage();
            awaitIdle(loader);
            assertEquals(List.of("finish INITIAL_PAGE(1) SUCCESS"), delegate.finishEvents());
        }
    }

    @Test
    void cancelAllReportsEveryLoadInFlight() throws Exception {
        ScriptedHelper helper = new ScriptedHelper().gate(1);
        RecordingDelegate delegate = new RecordingDelegate();

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader = newLoader(helper, delegate)) {
            loader.load(PageLoadDescription.of(1, LoadReason.NEXT_PAGE));
            loader.load(PageLoadDescription.of(2, LoadReason.NEXT_PAGE));
            loader.cancelAllLoadings();
            awaitIdle(loader);

            assertEquals(List.of(
                "finish NEXT_PAGE(1) CANCELLED",
                "finish NEXT_PAGE(2) CANCELLED"), delegate.finishEvents());
        }
    }

    @Test
    void failedLoadLeavesCursorsAndAcceptsFurtherLoads() throws Exception {
        ScriptedHelper helper = new ScriptedHelper()
            .page(1, 2, 0, "a")
            .page(3, 4, null, "c")
            .failFetch(2);
        RecordingDelegate delegate = new RecordingDelegate();

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader = newLoader(helper, delegate)) {
            loader.loadInitialPage();
            awaitIdle(loader);
            loader.loadNextPage();
            awaitIdle(loader);

            LoadResult<ScriptedHelper.Page> failed = delegate.results.get(1);
            assertTrue(failed.isFailure());
            assertFalse(failed.isCancelled());
            assertInstanceOf(IOException.class, failed.getError());
            assertEquals(Optional.of(2), loader.getNextPageInfo());
            assertEquals(Optional.of(0), loader.getPreviousPageInfo());

            loader.load(PageLoadDescription.of(3, LoadReason.NEXT_PAGE));
            awaitIdle(loader);
            assertEquals(Optional.of(4), loader.getNextPageInfo());
            assertEquals(1, loader.getStatistics().getFailed());
        }
    }

    @Test
    void extraDependenciesDelayTheStartWhateverTheirOutcome() throws Exception {
        ScriptedHelper helper = new ScriptedHelper().page(1, null, null, "a").page(2, null, null, "b");
        RecordingDelegate delegate = new RecordingDelegate();

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader = newLoader(helper, delegate)) {
            CompletableFuture<String> dependency = new CompletableFuture<>();
            loader.load(PageLoadDescription.of(1, LoadReason.SYNC), ConcurrentLoadBehavior.QUEUE, List.of(dependency));
            sleepMillis(100);
            assertTrue(delegate.snapshot().isEmpty(), "load must wait for its dependency");

            dependency.complete("done");
            awaitIdle(loader);
            assertEquals(List.of("finish SYNC(1) SUCCESS"), delegate.finishEvents());

            CompletableFuture<String> failing = new CompletableFuture<>();
            loader.load(PageLoadDescription.of(2, LoadReason.SYNC), ConcurrentLoadBehavior.QUEUE, List.of(failing));
            failing.completeExceptionally(new IllegalStateException("upstream failed"));
            awaitIdle(loader);
            assertEquals(List.of("finish SYNC(1) SUCCESS", "finish SYNC(2) SUCCESS"), delegate.finishEvents());
        }
    }

    @Test
    void initialPageRemovesLocalObjectsItNoLongerContains() throws Exception {
        ScriptedHelper helper = new ScriptedHelper()
            .page(1, 2, null, "a", "b")
            .page(2, null, null, "c");
        helper.local.addAll(List.of("old", "kept", "a"));
        RecordingDelegate delegate = new RecordingDelegate();
        delegate.protectedObjects.add("kept");

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader = newLoader(helper, delegate)) {
            loader.loadInitialPage();
            awaitIdle(loader);
            assertEquals(List.of("kept", "a", "b"), helper.local);

            loader.loadNextPage();
            awaitIdle(loader);
            assertEquals(List.of("kept", "a", "b", "c"), helper.local);
        }
    }

    @Test
    void admittedLoadsKeepTheDelegateTheyWereAdmittedWith() throws Exception {
        ScriptedHelper helper = new ScriptedHelper().gate(1);
        RecordingDelegate first = new RecordingDelegate();
        RecordingDelegate second = new RecordingDelegate();

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader = newLoader(helper, first)) {
            loader.load(PageLoadDescription.of(1, LoadReason.NEXT_PAGE));
            waitFor(() -> first.events.contains("start NEXT_PAGE(1)"), "page 1 to start");
            loader.setDelegate(second);
            helper.release(1);
            loader.load(PageLoadDescription.of(2, LoadReason.NEXT_PAGE));
            awaitIdle(loader);

            assertEquals(List.of("finish NEXT_PAGE(1) SUCCESS"), first.finishEvents());
            assertEquals(List.of("finish NEXT_PAGE(2) SUCCESS"), second.finishEvents());
            assertSame(second, loader.getDelegate());
        }
    }

    @Test
    void failingDelegateDoesNotStopTheLoader() throws Exception {
        ScriptedHelper helper = new ScriptedHelper();
        AtomicInteger finished = new AtomicInteger();
        HandlerCollectionLoaderDelegate<Integer, String, List<String>, ScriptedHelper.Page> delegate =
            HandlerCollectionLoaderDelegate.<Integer, String, List<String>, ScriptedHelper.Page>builder()
                .onWillStartLoading(pageLoad -> {
                    throw new IllegalStateException("broken start handler");
                })
                .onDidFinishLoading((pageLoad, result) -> {
                    finished.incrementAndGet();
                    throw new IllegalStateException("broken finish handler");
                })
                .build();

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader =
                 CollectionLoaders.forHelper(helper).withDelegate(delegate).build()) {
            loader.load(PageLoadDescription.of(1, LoadReason.NEXT_PAGE));
            loader.load(PageLoadDescription.of(2, LoadReason.NEXT_PAGE));
            awaitIdle(loader);

            assertEquals(2, finished.get());
            assertEquals(2, loader.getStatistics().getSucceeded());
        }
    }

    @Test
    void delegateErrorsKeepTheQueueConsistent() throws Exception {
        ScriptedHelper helper = new ScriptedHelper();
        List<String> finished = new CopyOnWriteArrayList<>();
        HandlerCollectionLoaderDelegate<Integer, String, List<String>, ScriptedHelper.Page> delegate =
            HandlerCollectionLoaderDelegate.<Integer, String, List<String>, ScriptedHelper.Page>builder()
                .onWillStartLoading(pageLoad -> {
                    if (pageLoad.getPageInfo() == 1) {
                        throw new AssertionError("start handler broke on page 1");
                    }
                })
                .onDidFinishLoading((pageLoad, result) -> {
                    finished.add(pageLoad + " " + RecordingDelegate.outcome(result));
                    if (pageLoad.getPageInfo() == 2) {
                        throw new AssertionError("finish handler broke on page 2");
                    }
                })
                .build();

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader =
                 CollectionLoaders.forHelper(helper).withDelegate(delegate).build()) {
            loader.load(PageLoadDescription.of(1, LoadReason.NEXT_PAGE));
            loader.load(PageLoadDescription.of(2, LoadReason.NEXT_PAGE));
            awaitIdle(loader);

            assertEquals(List.of("NEXT_PAGE(1) SUCCESS", "NEXT_PAGE(2) SUCCESS"), finished);
            assertEquals(Optional.empty(), loader.getCurrentPageLoad());
            assertTrue(loader.getStatistics().isIdle());

            loader.load(PageLoadDescription.of(3, LoadReason.NEXT_PAGE));
            awaitIdle(loader);

            assertEquals(List.of("NEXT_PAGE(1) SUCCESS", "NEXT_PAGE(2) SUCCESS", "NEXT_PAGE(3) SUCCESS"), finished);
            assertEquals(3, loader.getStatistics().getSucceeded());
        }
    }

    @Test
    void throwingWillFinishLoadingFailsTheLoad() throws Exception {
        ScriptedHelper helper = new ScriptedHelper()
            .page(1, 2, null, "a")
            .page(2, 3, 1, "b");
        AtomicBoolean rejectImports = new AtomicBoolean(false);
        IOException rejection = new IOException("store refused the import");
        List<LoadResult<ScriptedHelper.Page>> results = new CopyOnWriteArrayList<>();
        HandlerCollectionLoaderDelegate<Integer, String, List<String>, ScriptedHelper.Page> delegate =
            HandlerCollectionLoaderDelegate.<Integer, String, List<String>, ScriptedHelper.Page>builder()
                .onWillFinishLoading((pageLoad, imported, check) -> {
                    if (rejectImports.get()) {
                        throw rejection;
                    }
                })
                .onDidFinishLoading((pageLoad, result) -> results.add(result))
                .build();

        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader =
                 CollectionLoaders.forHelper(helper).withDelegate(delegate).build()) {
            loader.loadInitialPage();
            awaitIdle(loader);
            assertEquals(Optional.of(2), loader.getNextPageInfo());

            rejectImports.set(true);
            loader.loadNextPage();
            awaitIdle(loader);

            assertEquals(2, results.size());
            LoadResult<ScriptedHelper.Page> rejected = results.get(1);
            assertTrue(rejected.isFailure());
            assertFalse(rejected.isCancelled());
            assertSame(rejection, rejected.getError());
            assertEquals(Optional.of(2), loader.getNextPageInfo());
            assertEquals(Optional.empty(), loader.getPreviousPageInfo());
            assertEquals(1, loader.getStatistics().getFailed());

            rejectImports.set(false);
            loader.loadNextPage();
            awaitIdle(loader);

            assertEquals(3, results.size());
            assertTrue(results.get(2).isSuccess());
            assertEquals(Optional.of(3), loader.getNextPageInfo());
        }
    }

    @Test
    void loadsWithoutADelegate() throws Exception {
        ScriptedHelper helper = new ScriptedHelper().page(1, 2, null, "a");
        try (CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader =
                 CollectionLoaders.forHelper(helper).build()) {
            assertNull(loader.getDelegate());
            loader.loadInitialPage();
            awaitIdle(loader);
            assertEquals(Optional.of(2), loader.getNextPageInfo());
            assertEquals(List.of("a"), helper.local);
        }
    }

    @Test
    void closedLoaderRejectsRequests() {
        ScriptedHelper helper = new ScriptedHelper();
        CollectionLoader<Integer, String, List<String>, ScriptedHelper.Page> loader =
            CollectionLoaders.forHelper(helper).build();
        loader.close();

        assertThrows(RejectedExecutionException.class, loader::loadInitialPage);
    }
}
