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
import io.github.vmforge.provisioning.application.port.NotificationSender;
import io.github.vmforge.provisioning.application.port.ProjectionUpdater;
import io.github.vmforge.provisioning.application.port.TimelineEventType;
import io.github.vmforge.provisioning.application.port.TimelineUpdater;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestStatus;

/**
 * Cancels a request on behalf of its requester. Cancelling an already cancelled request succeeds without any change.
 */
public class CancelVmRequestHandler extends VmRequestCommandHandler {

    public CancelVmRequestHandler(EventStore eventStore, ProjectionUpdater projectionUpdater,
            TimelineUpdater timelineUpdater, NotificationSender notificationSender) {
        super(eventStore, projectionUpdater, timelineUpdater, notificationSender);
    }

    public Result<CommandResult, CommandError> handle(CancelVmRequestCommand command) {
        EventMetadata metadata = EventMetadata.create(command.getTenantId(), command.getUserId(),
            command.getCorrelationId());
        String reason = command.getReason().orElse(null);
        return loadRequest(command.getTenantId(), command.getRequestId()).flatMap(request -> {
            boolean[] changed = new boolean[1];
            return execute(request, () -> changed[0] = request.cancel(command.getUserId(), reason, metadata))
                .map(version -> {
                    if (changed[0]) {
                        bestEffort("update projection of " + request.getId(), () ->
                            projectionUpdater.updateStatus(request.getTenantId(), request.getId(),
                                VmRequestStatus.CANCELLED, version));
                        addTimelineEntry(request, TimelineEventType.CANCELLED, metadata.getCorrelationId(), metadata,
                            reason);
                    } else {
                        logger.debug("Request {} already cancelled", request.getId());
                    }
                    return new CommandResult(request.getId(), version);
                });
        });
    }
}
