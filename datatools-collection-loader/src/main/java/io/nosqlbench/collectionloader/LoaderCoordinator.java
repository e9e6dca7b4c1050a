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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The coordination thread of a {@link CollectionLoader}. Each loader owns exactly one
 * coordinator, which runs a single daemon thread executing submitted tasks in FIFO order.
 * All loader state is read and written on this thread, so none of it needs locking.
 *
 * <p>Key Responsibilities:
 * <ul>
 *   <li><strong>Serialization:</strong> runs load admissions, prestart and completion tasks one at a time</li>
 *   <li><strong>Isolation:</strong> a task throwing an exception is logged and does not stop the loop</li>
 *   <li><strong>Defect handling:</strong> a {@link PipelineInvariantViolation} is logged at FATAL
 *       and halts the coordinator; later submissions are rejected</li>
 * </ul>
 *
 * <p>This class is package-private and should only be instantiated by {@link CollectionLoader}.
 *
 * @since 4.0.0
 */
final class LoaderCoordinator implements Executor, AutoCloseable {

    private static final Logger logger = LogManager.getLogger(LoaderCoordinator.class);

    private final BlockingQueue<Runnable> tasks = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final Thread coordinatorThread;
    private volatile PipelineInvariantViolation violation;

    LoaderCoordinator(String threadName) {
        this.coordinatorThread = new Thread(this::runLoop, threadName);
        this.coordinatorThread.setDaemon(true);
        this.coordinatorThread.start();
    }

    @Override
    public void execute(Runnable task) {
        if (violation != null) {
            throw new RejectedExecutionException("Coordinator " + coordinatorThread.getName()
                + " halted after an invariant violation", violation);
        }
        if (!running.get()) {
            throw new RejectedExecutionException("Coordinator " + coordinatorThread.getName() + " is closed");
        }
        tasks.add(task);
    }

    /**
     * @return true when called from the coordination thread itself
     */
    boolean isCoordinatorThread() {
        return Thread.currentThread() == coordinatorThread;
    }

    /**
     * @return the invariant violation that halted this coordinator, or null
     */
    PipelineInvariantViolation getViolation() {
        return violation;
    }

    private void runLoop() {
        while (running.get()) {
            Runnable task;
            try {
                task = tasks.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                task.run();
            } catch (PipelineInvariantViolation v) {
                logger.fatal("Collection loader invariant violated, halting {}: {}",
                    coordinatorThread.getName(), v.getMessage(), v);
                violation = v;
                running.set(false);
            } catch (Throwable t) {
                logger.error("Error running coordinator task: {}", t.getMessage(), t);
            }
        }
        tasks.clear();
    }

    /**
     * Stops the coordination thread. Queued tasks are dropped. Idempotent.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            coordinatorThread.interrupt();
            if (!isCoordinatorThread()) {
                try {
                    coordinatorThread.join(500);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }
}
