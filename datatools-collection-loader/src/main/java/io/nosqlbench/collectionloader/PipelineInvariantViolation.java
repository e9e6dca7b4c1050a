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
 * Internal bookkeeping of a {@link CollectionLoader} is corrupt: a pipeline started while
 * another one was current, or out of submission order. This is a defect in the loader,
 * not a condition callers can provoke, so it is an {@link AssertionError}. The loader's
 * coordination thread stops when it sees one.
 *
 * @since 4.0.0
 */
public class PipelineInvariantViolation extends AssertionError {

    public PipelineInvariantViolation(String message) {
        super(message);
    }
}
