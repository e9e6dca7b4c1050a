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

/**
 * Callbacks a {@link LoadingOperation} makes into its loader while it runs. All of them
 * are invoked on the thread running the operation, in the order declared here.
 *
 * <p>Helpers receive an instance of this interface from the loader when asked for an
 * operation, and must wire their operation to call it.
 *
 * @param <R> the pre-completion results type: what an import produced, before the
 *            loader completes the load
 * @since 4.0.0
 */
public interface LoadingOperationDelegate<R> {

    /**
     * Called before the operation goes to its remote source.
     *
     * @param check cancellation checkpoint
     * @throws Exception to fail the operation
     */
    void remoteOperationWillStart(CancellationCheck check) throws Exception;

    /**
     * Called once the remote results are available, before importing them.
     * When this returns false the results are not imported but the operation still
     * finishes successfully.
     *
     * @param check cancellation checkpoint
     * @return whether to import the results
     * @throws Exception to fail the operation without importing
     */
    boolean operationWillImportResults(CancellationCheck check) throws Exception;

    /**
     * Called right after the import, still on the import thread.
     *
     * @param results the imported objects
     * @param check cancellation checkpoint
     * @throws Exception to fail the operation
     */
    void operationDidFinishImport(R results, CancellationCheck check) throws Exception;
}
