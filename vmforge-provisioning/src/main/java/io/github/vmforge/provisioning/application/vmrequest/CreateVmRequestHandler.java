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
import io.github.vmforge.provisioning.application.port.VmRequestSummary;
import io.github.vmforge.provisioning.domain.InvalidValueException;
import io.github.vmforge.provisioning.domain.vmrequest.VmName;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestAggregate;
import io.github.vmforge.provisioning.domain.vmrequest.VmSize;

public class CreateVmRequestHandler extends VmRequestCommandHandler {

    public CreateVmRequestHandler(EventStore eventStore, ProjectionUpdater projectionUpdater,
            TimelineUpdater timelineUpdater, NotificationSender notificationSender) {
        super(eventStore, projectionUpdater, timelineUpdater, notificationSender);
    }

    /**
     * Validate input and create a pending request.
     * @param command the command
     * @return id and version of the new request
     */
    public Result<CommandResult, CommandError> handle(CreateVmRequestCommand command) {
        EventMetadata metadata = EventMetadata.create(command.getTenantId(), command.getUserId(),
            command.getCorrelationId());
        VmRequestAggregate created;
        try {
            created = VmRequestAggregate.create(command.getUserEmail(), command.getProjectId(),
                command.getProjectName(), VmName.of(command.getVmName()), VmSize.fromCode(command.getSize()),
                command.getJustification(), metadata);
        } catch (InvalidValueException e) {
            logger.info("Invalid VM request of user {}: {}", command.getUserId(), e.getMessage());
            return Result.failure(CommandError.of(e));
        }
        VmRequestAggregate request = created;
        return commit(request).map(version -> {
            bestEffort("insert projection of request " + request.getId(), () ->
                projectionUpdater.insert(new VmRequestSummary.Builder()
                    .requestId(request.getId())
                    .tenantId(request.getTenantId())
                    .requesterId(request.getRequesterId())
                    .requesterEmail(request.getRequesterEmail())
                    .projectId(request.getProjectId())
                    .projectName(request.getProjectName())
                    .vmName(request.getVmName())
                    .size(request.getSize())
                    .justification(request.getJustification())
                    .status(request.getStatus())
                    .version(version)
                    .createdAt(metadata.getTimestamp())
                    .build()));
            addTimelineEntry(request, TimelineEventType.CREATED, request.getId(), metadata, null);
            bestEffort("send created notification of " + request.getId(), () ->
                notificationSender.sendCreated(Notifications.of(request)));
            return new CommandResult(request.getId(), version);
        });
    }
}
