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

package io.nosqlbench.collectionloader.delegates;

import io.nosqlbench.collectionloader.CollectionLoaderDelegate;
import io.nosqlbench.collectionloader.PageLoadDescription;
import io.nosqlbench.collectionloader.operation.CancellationCheck;
import io.nosqlbench.collectionloader.operation.LoadResult;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * A delegate that records page load lifecycle events through Log4j 2, then forwards each
 * event to an optional wrapped delegate. Useful to trace a loader in production logs
 * without touching the delegate that drives the application.
 *
 * <h2>Log Message Format</h2>
 * <ul>
 *   <li><strong>Start:</strong> "Page load started: NEXT_PAGE(3)"</li>
 *   <li><strong>Finish:</strong> "Page load finished: NEXT_PAGE(3) - SUCCESS"
 *       (or FAILED / CANCELLED with the error message)</li>
 *   <li><strong>Veto:</strong> "Page load kept object: ..." when the wrapped delegate refuses a removal</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * loader.setDelegate(new LoggingCollectionLoaderDelegate<>(appDelegate, "app.paging", Level.INFO));
 * }</pre>
 *
 * <p>Failures are logged at WARN whatever the configured level; cancellations use the
 * configured level.
 *
 * @since 4.0.0
 */
public class LoggingCollectionLoaderDelegate<P, F, R, C> implements CollectionLoaderDelegate<P, F, R, C> {

    private final CollectionLoaderDelegate<P, F, R, C> wrapped;
    private final Logger logger;
    private final Level level;

    public LoggingCollectionLoaderDelegate() {
        this(null);
    }

    public LoggingCollectionLoaderDelegate(CollectionLoaderDelegate<P, F, R, C> wrapped) {
        this(wrapped, LogManager.getLogger(LoggingCollectionLoaderDelegate.class), Level.INFO);
    }

    public LoggingCollectionLoaderDelegate(CollectionLoaderDelegate<P, F, R, C> wrapped, String loggerName, Level level) {
        this(wrapped, LogManager.getLogger(loggerName), level);
    }

    public LoggingCollectionLoaderDelegate(CollectionLoaderDelegate<P, F, R, C> wrapped, Logger logger, Level level) {
        this.wrapped = wrapped;
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNullElse(level, Level.INFO);
    }

    @Override
    public void willStartLoading(PageLoadDescription<P> pageLoad) {
        log(level, "Page load started: " + pageLoad);
        if (wrapped != null) {
            wrapped.willStartLoading(pageLoad);
        }
    }

    @Override
    public void didFinishLoading(PageLoadDescription<P> pageLoad, LoadResult<C> results) {
        if (results.isSuccess()) {
            log(level, "Page load finished: " + pageLoad + " - SUCCESS");
        } else if (results.isCancelled()) {
            log(level, "Page load finished: " + pageLoad + " - CANCELLED");
        } else {
            log(Level.WARN, "Page load finished: " + pageLoad + " - FAILED: " + results.getError().getMessage());
        }
        if (wrapped != null) {
            wrapped.didFinishLoading(pageLoad, results);
        }
    }

    @Override
    public boolean canDelete(F object) {
        if (wrapped == null) {
            return true;
        }
        boolean allowed = wrapped.canDelete(object);
        if (!allowed) {
            log(level, "Page load kept object: " + object);
        }
        return allowed;
    }

    @Override
    public void willFinishLoading(PageLoadDescription<P> pageLoad, R preCompletionResults, CancellationCheck check)
        throws Exception {
        if (wrapped != null) {
            wrapped.willFinishLoading(pageLoad, preCompletionResults, check);
        }
    }

    private void log(Level effectiveLevel, String message) {
        if (logger.isEnabled(effectiveLevel)) {
            logger.log(effectiveLevel, message);
        }
    }
}
