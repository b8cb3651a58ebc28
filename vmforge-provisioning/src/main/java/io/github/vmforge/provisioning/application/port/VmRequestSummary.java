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
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestStatus;
import io.github.vmforge.provisioning.domain.vmrequest.VmSize;
import org.immutables.value.Value;

import java.time.Instant;

/**
 * Row of the VM request read model.
 */
@Value.Immutable
@VmForgeStyle
public interface VmRequestSummary {
    String getRequestId();

    String getTenantId();

    String getRequesterId();

    String getRequesterEmail();

    String getProjectId();

    String getProjectName();

    String getVmName();

    VmSize getSize();

    String getJustification();

    VmRequestStatus getStatus();

    long getVersion();

    Instant getCreatedAt();

    class Builder extends ImmutableVmRequestSummary.Builder {

    }
}
