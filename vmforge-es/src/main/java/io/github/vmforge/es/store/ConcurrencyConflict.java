package io.github.vmforge.es.store;

/*-
 * #%L
 * vmforge-es
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.Objects;

/**
 * Append was rejected because the stream moved on since the caller read it. The caller needs to reload and decide
 * again, there is no automatic retry.
 */
public final class ConcurrencyConflict {
    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflict(String aggregateId, long expectedVersion, long actualVersion) {
        this.aggregateId = Objects.requireNonNull(aggregateId);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConcurrencyConflict)) {
            return false;
        }
        ConcurrencyConflict that = (ConcurrencyConflict) o;
        return expectedVersion == that.expectedVersion && actualVersion == that.actualVersion
                && aggregateId.equals(that.aggregateId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, expectedVersion, actualVersion);
    }

    @Override
    public String toString() {
        return "ConcurrencyConflict{" + aggregateId + " expected=" + expectedVersion + ", actual=" + actualVersion
                + '}';
    }
}
