package io.github.vmforge.provisioning.application.port;

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
 * Configuration of a tenant was changed since the caller read it, or created by someone else meanwhile.
 */
public final class ConfigurationConflict {
    private final String tenantId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConfigurationConflict(String tenantId, long expectedVersion, long actualVersion) {
        this.tenantId = Objects.requireNonNull(tenantId, "Tenant id is required");
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getTenantId() {
        return tenantId;
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
        if (!(o instanceof ConfigurationConflict)) {
            return false;
        }
        ConfigurationConflict that = (ConfigurationConflict) o;
        return expectedVersion == that.expectedVersion && actualVersion == that.actualVersion
                && tenantId.equals(that.tenantId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, expectedVersion, actualVersion);
    }

    @Override
    public String toString() {
        return "ConfigurationConflict{" + tenantId + " expected " + expectedVersion + " actual " + actualVersion + '}';
    }
}
