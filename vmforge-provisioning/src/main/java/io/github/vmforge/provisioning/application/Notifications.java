package io.github.vmforge.provisioning.application;

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

import io.github.vmforge.provisioning.application.port.RequestNotification;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestAggregate;

/**
 * Notification data of a request.
 */
public final class Notifications {
    private Notifications() {
    }

    public static RequestNotification of(VmRequestAggregate request) {
        return new RequestNotification.Builder()
                .tenantId(request.getTenantId())
                .requestId(request.getId())
                .requesterEmail(request.getRequesterEmail())
                .vmName(request.getVmName())
                .projectName(request.getProjectName())
                .build();
    }
}
