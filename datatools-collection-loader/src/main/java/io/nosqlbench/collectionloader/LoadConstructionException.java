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
 * The helper could not build a loading operation for a page. No pipeline exists for such
 * a load; the failure is reported to the delegate immediately.
 *
 * @since 4.0.0
 */
public class LoadConstructionException extends CollectionLoaderException {

    private final PageLoadDescription<?> pageLoad;

    public LoadConstructionException(PageLoadDescription<?> pageLoad, Throwable cause) {
        super("could not create a loading operation for " + pageLoad + ": " + cause.getMessage(), cause);
        this.pageLoad = pageLoad;
    }

    /**
     * @return the page load the operation was requested for
     */
    public PageLoadDescription<?> getPageLoad() {
        return pageLoad;
    }
}
