package io.github.vmforge.provisioning.domain.vm;

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

/**
 * Stages a VM passes through while being provisioned, in order. {@link #READY} and {@link #FAILED} are terminal.
 */
public enum ProvisioningStage {
    CREATED(0),
    CLONING(120),
    CONFIGURING(30),
    POWERING_ON(30),
    WAITING_FOR_NETWORK(60),
    READY(0),
    FAILED(0);

    private final int nominalSeconds;

    ProvisioningStage(int nominalSeconds) {
        this.nominalSeconds = nominalSeconds;
    }

    public boolean isTerminal() {
        return this == READY || this == FAILED;
    }

    /**
     * Typical duration of the stage, used for remaining time estimates only.
     * @return seconds
     */
    public int getNominalSeconds() {
        return nominalSeconds;
    }

    /**
     * Rough estimate of time left once this stage was entered: the rest of this stage plus all stages after it.
     * @return estimated seconds, 0 for terminal stages
     */
    public int estimateRemainingSeconds() {
        if (isTerminal()) {
            return 0;
        }
        int remaining = 0;
        for (ProvisioningStage stage : values()) {
            if (!stage.isTerminal() && stage.ordinal() >= ordinal()) {
                remaining += stage.nominalSeconds;
            }
        }
        return remaining;
    }
}
