package io.github.vmforge.provisioning.infrastructure.hypervisor;

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

import java.util.Optional;

/**
 * State of an asynchronous hypervisor task.
 */
@Value.Immutable
@VmForgeStyle
public interface TaskInfo {

    enum State {
        QUEUED, RUNNING, SUCCESS, ERROR;

        public boolean isTerminal() {
            return this == SUCCESS || this == ERROR;
        }
    }

    String getTaskId();

    State getState();

    /**
     * Result of successful task, for clone tasks the id of the new VM.
     * @return task result
     */
    Optional<String> getResult();

    Optional<String> getErrorMessage();

    /**
     * Classification of the task error, when the hypervisor provides one.
     * @return fault of failed task
     */
    Optional<HypervisorBindingException.Fault> getErrorFault();

    class Builder extends ImmutableTaskInfo.Builder {

    }
}
