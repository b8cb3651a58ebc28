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

import io.github.vmforge.es.Result;
import io.github.vmforge.provisioning.application.hypervisor.HypervisorConfiguration;

import java.util.Optional;

/**
 * Storage of tenant hypervisor configurations with optimistic locking. Stored configurations have version 1 or
 * higher, version 0 stands for "no configuration".
 */
public interface HypervisorConfigurationRepository {

    Optional<HypervisorConfiguration> findByTenantId(String tenantId);

    /**
     * Store first configuration of a tenant.
     * @param configuration the configuration, its version is ignored
     * @return stored configuration with version 1, or conflict when the tenant already has one
     */
    Result<HypervisorConfiguration, ConfigurationConflict> save(HypervisorConfiguration configuration);

    /**
     * Replace configuration of a tenant, when it was not changed since {@code expectedVersion}.
     * @param configuration new configuration, its version is ignored
     * @param expectedVersion version the change is based on
     * @return stored configuration with incremented version, or conflict with expected and actual version
     */
    Result<HypervisorConfiguration, ConfigurationConflict> update(HypervisorConfiguration configuration,
            long expectedVersion);
}
