package io.github.vmforge.provisioning.application.vmrequest;

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

import io.github.vmforge.es.EventMetadata;
import io.github.vmforge.es.Result;
import io.github.vmforge.es.store.EventStore;
import io.github.vmforge.provisioning.application.CommandError;
import io.github.vmforge.provisioning.application.CommandResult;
import io.github.vmforge.provisioning.application.Notifications;
import io.github.vmforge.provisioning.application.port.NotificationSender;
import io.github.vmforge.provisioning.application.port.ProjectionUpdater;
import io.github.vmforge.provisioning.application.port.TimelineEventType;
import io.github.vmforge.provisioning.application.port.TimelineUpdater;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestStatus;

public class RejectVmRequestHandler extends VmRequestCommandHandler {

    public RejectVmRequestHandler(EventStore eventStore, ProjectionUpdater projectionUpdater,
            TimelineUpdater timelineUpdater, NotificationSender notificationSender) {
        super(eventStore, projectionUpdater, timelineUpdater, notificationSender);
    }

    public Result<CommandResult, CommandError> handle(RejectVmRequestCommand command) {
        EventMetadata metadata = EventMetadata.create(command.getTenantId(), command.getAdminId(),
            command.getCorrelationId());
        String reason = command.getReason().trim();
        return loadRequest(command.getTenantId(), command.getRequestId()).flatMap(request -> execute(request,
            () -> request.reject(command.getAdminId(), command.getReason(), metadata)).map(version -> {
                bestEffort("update projection of " + request.getId(), () ->
                    projectionUpdater.updateStatus(request.getTenantId(), request.getId(),
                        VmRequestStatus.REJECTED, version));
                addTimelineEntry(request, TimelineEventType.REJECTED, metadata.getCorrelationId(), metadata, reason);
                bestEffort("send rejected notification of " + request.getId(), () ->
                    notificationSender.sendRejected(Notifications.of(request), reason));
                return new CommandResult(request.getId(), version);
            }));
    }
}
