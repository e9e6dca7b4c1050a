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

import java.util.Objects;

/**
 * Identifies one page load: the page to load and the reason for loading it.
 * Equality is structural, which is what the skip behaviors of
 * {@link ConcurrentLoadBehavior} compare.
 *
 * @param <P> the helper's page info type
 * @since 4.0.0
 */
public final class PageLoadDescription<P> {

    private final P pageInfo;
    private final LoadReason reason;

    public PageLoadDescription(P pageInfo, LoadReason reason) {
        this.pageInfo = Objects.requireNonNull(pageInfo, "pageInfo");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public static <P> PageLoadDescription<P> of(P pageInfo, LoadReason reason) {
        return new PageLoadDescription<>(pageInfo, reason);
    }

    public P getPageInfo() {
        return pageInfo;
    }

    public LoadReason getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PageLoadDescription)) {
            return false;
        }
        PageLoadDescription<?> that = (PageLoadDescription<?>) o;
        return pageInfo.equals(that.pageInfo) && reason == that.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(pageInfo, reason);
    }

    @Override
    public String toString() {
        return reason + "(" + pageInfo + ")";
    }
}
