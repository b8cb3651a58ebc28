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

import io.github.vmforge.provisioning.VmForgeStyle;
import io.github.vmforge.provisioning.domain.vm.ProvisioningStage;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Transient view of a running provisioning, replaced on every stage change and deleted when provisioning ends.
 */
@Value.Immutable
@VmForgeStyle
public interface ProvisioningProgress {
    String getVmId();

    String getRequestId();

    String getTenantId();

    ProvisioningStage getStage();

    String getDetails();

    Instant getStartedAt();

    Instant getUpdatedAt();

    /**
     * When each stage reached so far was first entered.
     * @return stage timestamps
     */
    Map<ProvisioningStage, Instant> getStageTimestamps();

    /**
     * Rough estimate for display, not a promise.
     * @return seconds until provisioning is expected to finish
     */
    int getEstimatedRemainingSeconds();

    class Builder extends ImmutableProvisioningProgress.Builder {

    }
}
