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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * A unit of work that runs on a given executor once all of its dependencies have finished.
 * A dependency counts as finished whatever its outcome, so a failed step never stalls the
 * steps chained after it. Chained tasks cannot be cancelled; only the work they wrap can
 * decide to do nothing.
 *
 * <p>Dependencies are added before {@link #enqueue()}; the task is enqueued once.
 */
final class ChainedTask {

    private final String name;
    private final Executor executor;
    private final Runnable body;
    private final List<CompletableFuture<?>> dependencies = new ArrayList<>();
    private final CompletableFuture<Void> finished = new CompletableFuture<>();
    private boolean enqueued;

    ChainedTask(String name, Executor executor, Runnable body) {
        this.name = Objects.requireNonNull(name, "name");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.body = Objects.requireNonNull(body, "body");
    }

    void addDependency(ChainedTask other) {
        addDependency(other.finished);
    }

    void addDependency(CompletionStage<?> stage) {
        Objects.requireNonNull(stage, "stage");
        if (enqueued) {
            throw new IllegalStateException("Cannot add a dependency to " + name + " after it was enqueued");
        }
        dependencies.add(stage.toCompletableFuture());
    }

    /**
     * Schedules the body to run on the executor once every dependency has finished.
     */
    void enqueue() {
        if (enqueued) {
            throw new IllegalStateException(name + " was already enqueued");
        }
        enqueued = true;
        CompletableFuture.allOf(dependencies.toArray(new CompletableFuture<?>[0]))
            .whenComplete((ignored, dependencyError) -> submit());
    }

    /**
     * @return a stage completing when the body has run; exceptionally if the body threw
     *         or could not be submitted
     */
    CompletionStage<Void> whenFinished() {
        return finished.minimalCompletionStage();
    }

    boolean isFinished() {
        return finished.isDone();
    }

    private void submit() {
        try {
            executor.execute(this::runBody);
        } catch (RejectedExecutionException e) {
            finished.completeExceptionally(e);
        }
    }

    private void runBody() {
        try {
            body.run();
            finished.complete(null);
        } catch (Throwable t) {
            finished.completeExceptionally(t);
            throw t;
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
