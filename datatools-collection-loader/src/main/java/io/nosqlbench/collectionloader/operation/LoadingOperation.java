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

package io.nosqlbench.collectionloader.operation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One fetch of one page, as built by a
 * {@link io.nosqlbench.collectionloader.CollectionLoaderHelper}. The loader runs it exactly
 * once on its fetch executor and reads {@link #getResult()} afterwards.
 *
 * <p>Cancellation is cooperative. {@link #cancel()} only raises a flag (and calls
 * {@link #onCancel()}); the implementation of {@link #execute(CancellationCheck)} is
 * expected to call the check it is given at safe points. An operation cancelled before it
 * starts does not execute at all and finishes with a {@link LoadCancelledException}.
 *
 * <h2>Implementing</h2>
 * <pre>{@code
 * class RemotePageOperation extends LoadingOperation<PageBody> {
 *     protected PageBody execute(CancellationCheck check) throws Exception {
 *         Response response = client.get(pageUrl);
 *         check.throwIfCancelled();
 *         return decode(response);
 *     }
 * }
 * }</pre>
 *
 * @param <C> the completion results type produced on success
 * @since 4.0.0
 */
public abstract class LoadingOperation<C> implements Runnable {

    private static final Logger logger = LogManager.getLogger(LoadingOperation.class);

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile LoadResult<C> result;

    /**
     * Does the actual loading work.
     *
     * @param check cancellation checkpoint to call between steps
     * @return the completion results
     * @throws Exception any failure; it becomes the failure of this operation's result
     */
    protected abstract C execute(CancellationCheck check) throws Exception;

    /**
     * Called once, from the cancelling thread, when this operation is cancelled. Subclasses
     * blocked on I/O can use it to abort the call in progress.
     */
    protected void onCancel() {
    }

    @Override
    public final void run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("loading operation " + this + " has already been run");
        }
        try {
            if (isCancelled()) {
                logger.trace("skipping execution of cancelled operation {}", this);
                result = LoadResult.failure(new LoadCancelledException());
                return;
            }
            C value = execute(this::throwIfCancelled);
            result = LoadResult.success(value);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            result = LoadResult.failure(e);
        } catch (Error e) {
            result = LoadResult.failure(e);
            throw e;
        } finally {
            finished.countDown();
        }
    }

    /**
     * Requests cancellation. Idempotent; has no effect on an operation that already finished.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true) && !isFinished()) {
            onCancel();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws LoadCancelledException if {@link #cancel()} has been called
     */
    public final void throwIfCancelled() throws LoadCancelledException {
        if (cancelled.get()) {
            throw new LoadCancelledException();
        }
    }

    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    /**
     * Waits for this operation to finish.
     *
     * @param timeout maximum time to wait
     * @param unit unit of the timeout
     * @return true if the operation finished within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitFinished(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    /**
     * @return the result of this finished operation
     * @throws IllegalStateException if the operation has not finished yet
     */
    public LoadResult<C> getResult() {
        LoadResult<C> current = result;
        if (current == null) {
            throw new IllegalStateException("loading operation " + this + " has not finished");
        }
        return current;
    }
}
