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

import io.nosqlbench.collectionloader.CollectionLoaderException;

/**
 * Raised by a {@link CancellationCheck} once the operation it guards has been cancelled.
 * A cancelled load is still completed and reported; this exception is the failure it
 * is reported with.
 *
 * @since 4.0.0
 */
public class LoadCancelledException extends CollectionLoaderException {

    public LoadCancelledException() {
        super("page load was cancelled");
    }

    public LoadCancelledException(String message) {
        super(message);
    }
}
