package io.github.vmforge.provisioning.application.vm;

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

import io.github.vmforge.provisioning.application.port.ProvisioningProgress;
import io.github.vmforge.provisioning.domain.vm.ProvisioningStage;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Accumulates stage timestamps of one provisioning across attempts and produces progress records out of them.
 */
class ProgressTracker {
    private final String vmId;
    private final String requestId;
    private final String tenantId;
    private final Clock clock;
    private final Instant startedAt;
    private final Map<ProvisioningStage, Instant> stageTimestamps = new EnumMap<>(ProvisioningStage.class);

    ProgressTracker(String vmId, String requestId, String tenantId, Clock clock) {
        this.vmId = vmId;
        this.requestId = requestId;
        this.tenantId = tenantId;
        this.clock = clock;
        this.startedAt = clock.instant();
        stageTimestamps.put(ProvisioningStage.CREATED, startedAt);
    }

    synchronized ProvisioningProgress reached(ProvisioningStage stage) {
        Instant now = clock.instant();
        stageTimestamps.putIfAbsent(stage, now);
        return new ProvisioningProgress.Builder()
                .vmId(vmId)
                .requestId(requestId)
                .tenantId(tenantId)
                .stage(stage)
                .details(describe(stage))
                .startedAt(startedAt)
                .updatedAt(now)
                .stageTimestamps(stageTimestamps)
                .estimatedRemainingSeconds(stage.estimateRemainingSeconds())
                .build();
    }

    private static String describe(ProvisioningStage stage) {
        switch (stage) {
            case CLONING:
                return "Cloning VM from template";
            case CONFIGURING:
                return "Applying VM configuration";
            case POWERING_ON:
                return "Starting VM";
            case WAITING_FOR_NETWORK:
                return "Waiting for IP address";
            case READY:
                return "VM is ready";
            default:
                return "Provisioning " + stage.name().toLowerCase(Locale.ROOT);
        }
    }
}
