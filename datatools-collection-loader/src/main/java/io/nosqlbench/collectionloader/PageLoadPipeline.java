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

import io.nosqlbench.collectionloader.operation.LoadingOperation;

import java.util.Collection;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * One admitted page load, split in three chained tasks:
 * <ol>
 *   <li><strong>prestart</strong> on the coordination thread: becomes the current load</li>
 *   <li><strong>loading</strong> on the fetch executor: runs the helper's operation</li>
 *   <li><strong>completion</strong> on the coordination thread: records the result and reports it</li>
 * </ol>
 *
 * <p>Each prestart waits for the previous pipeline's completion, so only one pipeline is
 * current at a time and pipelines complete in submission order even when the fetch
 * executor is a pool.
 *
 * <p>The helper and delegate are captured when the load is admitted and used for every
 * step of this pipeline.
 */
final class PageLoadPipeline<P, F, R, C> {

    /**
     * The coordination-thread steps of a pipeline, implemented by the loader.
     */
    interface Steps<P, F, R, C> {
        void prestart(PageLoadPipeline<P, F, R, C> pipeline);

        void complete(PageLoadPipeline<P, F, R, C> pipeline);
    }

    private final PageLoadDescription<P> pageLoad;
    private final LoadingOperation<C> operation;
    private final CollectionLoaderHelper<P, F, R, C> helper;
    private final CollectionLoaderDelegate<P, F, R, C> delegate;

    private final ChainedTask prestart;
    private final ChainedTask loading;
    private final ChainedTask completion;

    private volatile PipelineState state = PipelineState.QUEUED;

    PageLoadPipeline(PageLoadDescription<P> pageLoad,
                     LoadingOperation<C> operation,
                     CollectionLoaderHelper<P, F, R, C> helper,
                     CollectionLoaderDelegate<P, F, R, C> delegate,
                     Executor coordinator,
                     Executor fetchExecutor,
                     Steps<P, F, R, C> steps) {
        this.pageLoad = pageLoad;
        this.operation = operation;
        this.helper = helper;
        this.delegate = delegate;
        this.prestart = new ChainedTask("prestart " + pageLoad, coordinator, () -> steps.prestart(this));
        this.loading = new ChainedTask("loading " + pageLoad, fetchExecutor, operation);
        this.completion = new ChainedTask("completion " + pageLoad, coordinator, () -> steps.complete(this));
    }

    /**
     * Wires this pipeline after the previous one and after any extra dependencies.
     *
     * @param previous the pipeline admitted just before this one, or null
     * @param extraDependencies stages the prestart must also wait for
     */
    void setupDependencies(PageLoadPipeline<P, ?, ?, ?> previous, Collection<? extends CompletionStage<?>> extraDependencies) {
        if (previous != null) {
            // Every pipeline waits for its predecessor's completion, so one link is enough.
            prestart.addDependency(previous.completion);
        }
        for (CompletionStage<?> dependency : extraDependencies) {
            prestart.addDependency(dependency);
        }
        loading.addDependency(prestart);
        completion.addDependency(loading);
    }

    void enqueue() {
        prestart.enqueue();
        loading.enqueue();
        completion.enqueue();
    }

    /**
     * Cancels the loading operation only. The prestart and completion still run, so the
     * delegate is still notified.
     */
    void cancel() {
        operation.cancel();
    }

    PageLoadDescription<P> getPageLoad() {
        return pageLoad;
    }

    LoadingOperation<C> getOperation() {
        return operation;
    }

    CollectionLoaderHelper<P, F, R, C> getHelper() {
        return helper;
    }

    CollectionLoaderDelegate<P, F, R, C> getDelegate() {
        return delegate;
    }

    PipelineState getState() {
        return state;
    }

    void setState(PipelineState state) {
        this.state = state;
    }

    CompletionStage<Void> whenCompleted() {
        return completion.whenFinished();
    }

    @Override
    public String toString() {
        return pageLoad + " " + state.getGlyph() + " " + state;
    }
}
