package io.github.vmforge.provisioning.infrastructure.config;

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
import io.github.vmforge.provisioning.application.port.ConfigurationConflict;
import io.github.vmforge.provisioning.application.port.HypervisorConfigurationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Hypervisor configurations kept in memory. Version check and replacement of a tenant's configuration happen
 * atomically.
 */
public class InMemoryHypervisorConfigurationRepository implements HypervisorConfigurationRepository {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryHypervisorConfigurationRepository.class);

    private final Map<String, HypervisorConfiguration> configurations = new HashMap<>();

    @Override
    public synchronized Optional<HypervisorConfiguration> findByTenantId(String tenantId) {
        return Optional.ofNullable(configurations.get(tenantId));
    }

    @Override
    public synchronized Result<HypervisorConfiguration, ConfigurationConflict> save(
            HypervisorConfiguration configuration) {
        HypervisorConfiguration existing = configurations.get(configuration.getTenantId());
        if (existing != null) {
            return Result.failure(new ConfigurationConflict(configuration.getTenantId(), 0, existing.getVersion()));
        }
        return Result.success(store(configuration, 1));
    }

    @Override
    public synchronized Result<HypervisorConfiguration, ConfigurationConflict> update(
            HypervisorConfiguration configuration, long expectedVersion) {
        HypervisorConfiguration existing = configurations.get(configuration.getTenantId());
        long actual = existing == null ? 0 : existing.getVersion();
        if (existing == null || actual != expectedVersion) {
            logger.debug("Rejecting configuration update of tenant {}: expected version {}, actual {}",
                configuration.getTenantId(), expectedVersion, actual);
            return Result.failure(new ConfigurationConflict(configuration.getTenantId(), expectedVersion, actual));
        }
        return Result.success(store(configuration, actual + 1));
    }

    private HypervisorConfiguration store(HypervisorConfiguration configuration, long version) {
        HypervisorConfiguration stored = new HypervisorConfiguration.Builder()
                .from(configuration)
                .version(version)
                .build();
        configurations.put(stored.getTenantId(), stored);
        logger.info("Hypervisor configuration of tenant {} stored in version {} by {}", stored.getTenantId(),
            version, stored.getUpdatedBy());
        return stored;
    }
}
