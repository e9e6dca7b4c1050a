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

import io.nosqlbench.collectionloader.operation.LoadResult;
import io.nosqlbench.collectionloader.operation.LoadingOperation;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;

/**
 * Loads a paged collection with a helper.
 *
 * <p>The loader does not load anything itself: the operations returned by its
 * {@link CollectionLoaderHelper} do. The loader gives them a context in which loading
 * pages is easy and race free:
 * <ul>
 *   <li>only one page load is in progress at a time, and loads complete in the order they
 *       were admitted, even when the fetch executor runs operations on a pool</li>
 *   <li>a new load can queue behind, replace, supersede or be skipped in favor of the
 *       loads in flight ({@link ConcurrentLoadBehavior})</li>
 *   <li>the next and previous page infos are tracked from successful loads</li>
 *   <li>loading the initial page removes the local objects the page no longer contains</li>
 *   <li>the delegate is told when each load starts and finishes, exactly once per load,
 *       including cancelled and failed ones</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <p>All loader state lives on a single coordination thread. Public methods may be called
 * from any thread: their effect is handed to the coordination thread in call order, or run
 * inline when called from the coordination thread itself (for example from a delegate
 * callback). Loading operations run on the fetch executor.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * try (CollectionLoader<Integer, Item, List<Item>, Page> loader = CollectionLoaders.forHelper(helper)
 *         .withDelegate(delegate)
 *         .build()) {
 *     loader.loadInitialPage();
 *     loader.whenIdle().join();
 *     loader.loadNextPage();
 * }
 * }</pre>
 *
 * <p>A loading loader strongly references its helper and, for each admitted load, the
 * delegate that was set when the load was admitted, until the load has completed.
 *
 * @param <P> page info type
 * @param <F> fetched object type
 * @param <R> pre-completion results type
 * @param <C> completion results type
 * @see CollectionLoaders
 * @since 4.0.0
 */
public final class CollectionLoader<P, F, R, C> implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(CollectionLoader.class);

    private final CollectionLoaderHelper<P, F, R, C> helper;
    private final CollectionLoaderConfig config;
    private final LoaderCoordinator coordinator;
    private final ExecutorService fetchExecutor;
    private final boolean ownsFetchExecutor;
    private final PageCursors<P> cursors = new PageCursors<>();
    private final LoadStatistics statistics = new LoadStatistics();
    private final Level lifecycleLevel;
    private final PageLoadPipeline.Steps<P, F, R, C> steps = new PipelineSteps();

    private volatile CollectionLoaderDelegate<P, F, R, C> delegate;

    /* Only read and written on the coordination thread. */
    private volatile PageLoadPipeline<P, F, R, C> current;
    private final Deque<PageLoadPipeline<P, F, R, C>> pending = new ArrayDeque<>();

    CollectionLoader(CollectionLoaderHelper<P, F, R, C> helper,
                     CollectionLoaderConfig config,
                     ExecutorService fetchExecutor,
                     boolean ownsFetchExecutor,
                     CollectionLoaderDelegate<P, F, R, C> delegate) {
        this.helper = Objects.requireNonNull(helper, "helper");
        this.config = Objects.requireNonNull(config, "config");
        this.fetchExecutor = Objects.requireNonNull(fetchExecutor, "fetchExecutor");
        this.ownsFetchExecutor = ownsFetchExecutor;
        this.delegate = delegate;
        this.lifecycleLevel = config.getLifecycleLogLevel();
        this.coordinator = new LoaderCoordinator(config.getCoordinatorThreadName());
    }

    public CollectionLoaderHelper<P, F, R, C> getHelper() {
        return helper;
    }

    public CollectionLoaderConfig getConfig() {
        return config;
    }

    public CollectionLoaderDelegate<P, F, R, C> getDelegate() {
        return delegate;
    }

    /**
     * Sets the delegate notified of the loads admitted from now on. Loads already admitted
     * keep notifying the delegate they were admitted with.
     *
     * @param delegate the new delegate, or null for none
     */
    public void setDelegate(CollectionLoaderDelegate<P, F, R, C> delegate) {
        this.delegate = delegate;
    }

    public Optional<P> getNextPageInfo() {
        return cursors.getNext();
    }

    public Optional<P> getPreviousPageInfo() {
        return cursors.getPrevious();
    }

    /**
     * @return the load in progress, if any
     */
    public Optional<PageLoadDescription<P>> getCurrentPageLoad() {
        PageLoadPipeline<P, F, R, C> running = current;
        return running == null ? Optional.empty() : Optional.of(running.getPageLoad());
    }

    public LoadStatistics getStatistics() {
        return statistics;
    }

    /**
     * Loads the initial page: the one loaded when no page info is known, or when a complete
     * reload is wanted. Not named "first page" because in a bidirectional collection the
     * initial page need not be the first. Supersedes every load in flight by default.
     */
    public void loadInitialPage() {
        onCoordinator(() -> admit(
            PageLoadDescription.of(helper.initialPageInfo(), LoadReason.INITIAL_PAGE),
            config.getInitialPageBehavior(),
            List.of()));
    }

    /**
     * Loads the page after the last one loaded forward. Does nothing when no next page is
     * known. Skipped by default when another forward load is in flight.
     */
    public void loadNextPage() {
        onCoordinator(() -> cursors.getNext().ifPresent(next -> admit(
            PageLoadDescription.of(next, LoadReason.NEXT_PAGE),
            config.getNextPageBehavior(),
            List.of())));
    }

    /**
     * Loads the page before the last one loaded backward. Does nothing when no previous page
     * is known. Skipped by default when another backward load is in flight.
     */
    public void loadPreviousPage() {
        onCoordinator(() -> cursors.getPrevious().ifPresent(previous -> admit(
            PageLoadDescription.of(previous, LoadReason.PREVIOUS_PAGE),
            config.getPreviousPageBehavior(),
            List.of())));
    }

    /**
     * Cancels the operations of the current and all queued loads. The loads stay where they
     * are: each one still completes and reports a cancellation to its delegate.
     */
    public void cancelAllLoadings() {
        onCoordinator(() -> {
            if (current == null && pending.isEmpty()) {
                return;
            }
            log("Cancelling {} loads in flight", (current == null ? 0 : 1) + pending.size());
            if (current != null) {
                current.cancel();
            }
            pending.forEach(PageLoadPipeline::cancel);
        });
    }

    public void load(PageLoadDescription<P> pageLoad) {
        load(pageLoad, ConcurrentLoadBehavior.QUEUE, List.of());
    }

    public void load(PageLoadDescription<P> pageLoad, ConcurrentLoadBehavior behavior) {
        load(pageLoad, behavior, List.of());
    }

    /**
     * Requests a page load.
     *
     * <p>Only one page load runs at a time. An admitted load is queued behind every load
     * admitted before it; its start additionally waits for the given dependencies to finish,
     * whatever their outcome.
     *
     * @param pageLoad the page to load and why
     * @param behavior what to do with the loads already in flight
     * @param extraDependencies stages the load must wait for before it starts
     */
    public void load(PageLoadDescription<P> pageLoad,
                     ConcurrentLoadBehavior behavior,
                     Collection<? extends CompletionStage<?>> extraDependencies) {
        Objects.requireNonNull(pageLoad, "pageLoad");
        Objects.requireNonNull(behavior, "behavior");
        List<CompletionStage<?>> dependencies = List.copyOf(Objects.requireNonNull(extraDependencies, "extraDependencies"));
        onCoordinator(() -> admit(pageLoad, behavior, dependencies));
    }

    /**
     * Returns a future completing once every load admitted before this call has completed.
     * Requests made before this call from the same thread are taken into account.
     *
     * @return a future of the loader becoming idle
     */
    public CompletableFuture<Void> whenIdle() {
        CompletableFuture<Void> idle = new CompletableFuture<>();
        onCoordinator(() -> {
            PageLoadPipeline<P, F, R, C> tail = pending.isEmpty() ? current : pending.peekLast();
            if (tail == null) {
                idle.complete(null);
            } else {
                tail.whenCompleted().whenComplete((ignored, error) -> idle.complete(null));
            }
        });
        return idle;
    }

    /**
     * Stops the coordination thread, and the fetch executor when the loader created it.
     * Loads still in flight are not reported.
     */
    @Override
    public void close() {
        coordinator.close();
        if (ownsFetchExecutor) {
            fetchExecutor.shutdownNow();
        }
    }

    private void onCoordinator(Runnable action) {
        if (coordinator.isCoordinatorThread()) {
            action.run();
        } else {
            coordinator.execute(action);
        }
    }

    private void admit(PageLoadDescription<P> pageLoad,
                       ConcurrentLoadBehavior behavior,
                       List<CompletionStage<?>> extraDependencies) {
        /* The helper and the delegate are captured so every step of this load sees the same ones. */
        CollectionLoaderHelper<P, F, R, C> loadHelper = helper;
        CollectionLoaderDelegate<P, F, R, C> loadDelegate = delegate;

        statistics.incrementRequested();
        LoadRequestPolicy.Action action = LoadRequestPolicy.decide(behavior, pageLoad, inFlightPageLoads());
        switch (action) {
            case SKIP:
                statistics.incrementSkipped();
                log("Skipping {} ({})", pageLoad, behavior);
                return;
            case CANCEL_QUEUED_THEN_ADMIT:
                pending.forEach(PageLoadPipeline::cancel);
                break;
            case CANCEL_ALL_THEN_ADMIT:
                pending.forEach(PageLoadPipeline::cancel);
                if (current != null) {
                    current.cancel();
                }
                break;
            case ADMIT:
                break;
            default:
                throw new IllegalStateException("Unknown load action: " + action);
        }

        LoadingOperation<C> operation;
        try {
            operation = loadHelper.operationForLoading(
                pageLoad.getPageInfo(), new PageImportDelegate<>(loadHelper, pageLoad, loadDelegate));
            Objects.requireNonNull(operation, "helper returned no loading operation");
        } catch (Exception e) {
            statistics.incrementConstructionFailed();
            logger.warn("Could not create a loading operation for {}: {}", pageLoad, e.getMessage(), e);
            notifyDidFinishLoading(loadDelegate, pageLoad, LoadResult.failure(new LoadConstructionException(pageLoad, e)));
            return;
        }

        PageLoadPipeline<P, F, R, C> pipeline = new PageLoadPipeline<>(
            pageLoad, operation, loadHelper, loadDelegate, coordinator, fetchExecutor, steps);
        pipeline.setupDependencies(pending.isEmpty() ? current : pending.peekLast(), extraDependencies);
        pending.addLast(pipeline);
        statistics.incrementAdmitted();
        log("Admitted {} ({}, {} queued ahead)", pageLoad, behavior, pending.size() - 1 + (current == null ? 0 : 1));
        pipeline.enqueue();
    }

    private List<PageLoadDescription<P>> inFlightPageLoads() {
        List<PageLoadDescription<P>> inFlight = new ArrayList<>(pending.size() + 1);
        if (current != null) {
            inFlight.add(current.getPageLoad());
        }
        for (PageLoadPipeline<P, F, R, C> queued : pending) {
            inFlight.add(queued.getPageLoad());
        }
        return inFlight;
    }

    private void notifyWillStartLoading(CollectionLoaderDelegate<P, F, R, C> target, PageLoadDescription<P> pageLoad) {
        if (target == null) {
            return;
        }
        try {
            target.willStartLoading(pageLoad);
        } catch (RuntimeException e) {
            logger.error("Delegate failed in willStartLoading for {}: {}", pageLoad, e.getMessage(), e);
        }
    }

    private void notifyDidFinishLoading(CollectionLoaderDelegate<P, F, R, C> target,
                                        PageLoadDescription<P> pageLoad,
                                        LoadResult<C> results) {
        if (target == null) {
            return;
        }
        try {
            target.didFinishLoading(pageLoad, results);
        } catch (RuntimeException e) {
            logger.error("Delegate failed in didFinishLoading for {}: {}", pageLoad, e.getMessage(), e);
        }
    }

    private void log(String message, Object... params) {
        if (logger.isEnabled(lifecycleLevel)) {
            logger.log(lifecycleLevel, message, params);
        }
    }

    /**
     * The prestart and completion steps. Both run on the coordination thread.
     */
    private final class PipelineSteps implements PageLoadPipeline.Steps<P, F, R, C> {

        @Override
        public void prestart(PageLoadPipeline<P, F, R, C> pipeline) {
            try {
                notifyWillStartLoading(pipeline.getDelegate(), pipeline.getPageLoad());
            } finally {
                makeCurrent(pipeline);
            }
        }

        private void makeCurrent(PageLoadPipeline<P, F, R, C> pipeline) {
            /* By construction the starting pipeline is the head of the queue and nothing is current. */
            if (current != null) {
                throw new PipelineInvariantViolation(
                    "Starting " + pipeline + " while " + current + " is still current");
            }
            PageLoadPipeline<P, F, R, C> head = pending.pollFirst();
            if (head != pipeline) {
                throw new PipelineInvariantViolation(
                    "Starting " + pipeline + " but the head of the queue is " + head);
            }
            pipeline.setState(PipelineState.CURRENT);
            current = pipeline;
            log("Started {}", pipeline.getPageLoad());
        }

        @Override
        public void complete(PageLoadPipeline<P, F, R, C> pipeline) {
            LoadResult<C> results = null;
            try {
                results = readResults(pipeline);
            } finally {
                if (results == null) {
                    results = LoadResult.failure(new IllegalStateException(
                        "No results could be read for " + pipeline.getPageLoad()));
                }
                finish(pipeline, results);
            }
        }

        private LoadResult<C> readResults(PageLoadPipeline<P, F, R, C> pipeline) {
            CollectionLoaderHelper<P, F, R, C> pipelineHelper = pipeline.getHelper();
            PageLoadDescription<P> pageLoad = pipeline.getPageLoad();

            LoadResult<C> results;
            try {
                results = pipelineHelper.results(pipeline.getOperation());
            } catch (RuntimeException e) {
                results = LoadResult.failure(e);
            }

            if (results.isSuccess()) {
                C value = results.getValue();
                P loadedPage = pageLoad.getPageInfo();
                try {
                    cursors.recordSuccess(pageLoad.getReason(),
                        () -> pipelineHelper.nextPageInfo(value, loadedPage),
                        () -> pipelineHelper.previousPageInfo(value, loadedPage));
                } catch (RuntimeException e) {
                    logger.warn("Could not derive page infos from {}: {}", pageLoad, e.getMessage(), e);
                    results = LoadResult.failure(e);
                }
            }
            return results;
        }

        private void finish(PageLoadPipeline<P, F, R, C> pipeline, LoadResult<C> results) {
            PageLoadDescription<P> pageLoad = pipeline.getPageLoad();
            if (results.isSuccess()) {
                pipeline.setState(PipelineState.SUCCEEDED);
            } else {
                pipeline.setState(results.isCancelled() ? PipelineState.CANCELLED : PipelineState.FAILED);
            }

            current = null;
            statistics.recordCompletion(pipeline.getState());
            log("Finished {}", pipeline);

            notifyDidFinishLoading(pipeline.getDelegate(), pageLoad, results);
        }
    }
}
