package io.github.vmforge.provisioning.application;

/*-
 * #%L
 * vmforge-provisioning
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
 * Successful command: the aggregate it changed and version the aggregate reached.
 */
public final class CommandResult {
    private final String aggregateId;
    private final long version;

    public CommandResult(String aggregateId, long version) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id is required");
        this.version = version;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getVersion() {
        return version;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CommandResult && aggregateId.equals(((CommandResult) o).aggregateId)
                && version == ((CommandResult) o).version;
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, version);
    }

    @Override
    public String toString() {
        return "CommandResult{" + aggregateId + " at version " + version + '}';
    }
}
