package io.github.vmforge.provisioning.application.hypervisor;

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

import io.github.vmforge.provisioning.VmForgeStyle;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Connection parameters of a tenant's hypervisor. Password is stored encrypted and is only decrypted when a session
 * is opened. Changes are guarded by {@link #getVersion()}.
 */
@Value.Immutable
@VmForgeStyle
public interface HypervisorConfiguration {
    String DEFAULT_TEMPLATE = "ubuntu-22.04-template";

    String getTenantId();

    String getUrl();

    String getUsername();

    @Value.Redacted
    String getEncryptedPassword();

    String getDatacenterName();

    String getClusterName();

    String getDatastoreName();

    String getNetworkName();

    @Value.Default
    default String getTemplateName() {
        return DEFAULT_TEMPLATE;
    }

    /**
     * Folder for new VMs, relative to datacenter's VM folder.
     * @return folder path, or empty to create VMs in the root VM folder
     */
    Optional<String> getFolderPath();

    @Value.Default
    default long getVersion() {
        return 0;
    }

    String getUpdatedBy();

    Instant getUpdatedAt();

    class Builder extends ImmutableHypervisorConfiguration.Builder {

    }
}
