package io.github.vmforge.provisioning.infrastructure.eventstore;

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

import io.github.vmforge.es.store.json.JacksonEventSerialization;
import io.github.vmforge.provisioning.domain.vm.VmProvisionedEvent;
import io.github.vmforge.provisioning.domain.vm.VmProvisioningFailedEvent;
import io.github.vmforge.provisioning.domain.vm.VmProvisioningProgressUpdatedEvent;
import io.github.vmforge.provisioning.domain.vm.VmProvisioningStartedEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestApprovedEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestCancelledEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestCreatedEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestFailedEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestProvisioningStartedEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestReadyEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestRejectedEvent;

/**
 * JSON serialization knowing all events of VM requests and VMs, for use with a persistent event store.
 */
public final class ProvisioningEventSerialization {
    private ProvisioningEventSerialization() {
    }

    public static JacksonEventSerialization create() {
        return new JacksonEventSerialization()
                .registerImmutable(VmRequestCreatedEvent.class)
                .registerImmutable(VmRequestApprovedEvent.class)
                .registerImmutable(VmRequestRejectedEvent.class)
                .registerImmutable(VmRequestCancelledEvent.class)
                .registerImmutable(VmRequestProvisioningStartedEvent.class)
                .registerImmutable(VmRequestReadyEvent.class)
                .registerImmutable(VmRequestFailedEvent.class)
                .registerImmutable(VmProvisioningStartedEvent.class)
                .registerImmutable(VmProvisioningProgressUpdatedEvent.class)
                .registerImmutable(VmProvisionedEvent.class)
                .registerImmutable(VmProvisioningFailedEvent.class);
    }
}
