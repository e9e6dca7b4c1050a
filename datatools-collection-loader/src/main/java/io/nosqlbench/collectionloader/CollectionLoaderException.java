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
 * Base type for the recoverable failures a page load can end with. These are never
 * thrown out of {@link CollectionLoader}; they reach callers as the failure side of a
 * {@link io.nosqlbench.collectionloader.operation.LoadResult} passed to
 * {@link CollectionLoaderDelegate#didFinishLoading}.
 *
 * @since 4.0.0
 */
public class CollectionLoaderException extends Exception {

    public CollectionLoaderException(String message) {
        super(message);
    }

    public CollectionLoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
