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
import io.github.vmforge.provisioning.application.CommandHandlerSupport;
import io.github.vmforge.provisioning.application.port.NotificationSender;
import io.github.vmforge.provisioning.application.port.ProjectionUpdater;
import io.github.vmforge.provisioning.application.port.TimelineEntry;
import io.github.vmforge.provisioning.application.port.TimelineEventType;
import io.github.vmforge.provisioning.application.port.TimelineUpdater;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestAggregate;

import java.util.Objects;

/**
 * Base of handlers of user and admin commands on VM requests.
 */
abstract class VmRequestCommandHandler extends CommandHandlerSupport {
    protected final ProjectionUpdater projectionUpdater;
    protected final TimelineUpdater timelineUpdater;
    protected final NotificationSender notificationSender;

    protected VmRequestCommandHandler(EventStore eventStore, ProjectionUpdater projectionUpdater,
            TimelineUpdater timelineUpdater, NotificationSender notificationSender) {
        super(eventStore);
        this.projectionUpdater = Objects.requireNonNull(projectionUpdater, "Projection updater is required");
        this.timelineUpdater = Objects.requireNonNull(timelineUpdater, "Timeline updater is required");
        this.notificationSender = Objects.requireNonNull(notificationSender, "Notification sender is required");
    }

    /**
     * Load request of a tenant. Requests of other tenants are reported as not found.
     * @param tenantId tenant of the caller
     * @param requestId the request
     * @return request or error
     */
    protected Result<VmRequestAggregate, CommandError> loadRequest(String tenantId, String requestId) {
        return load(requestId, VmRequestAggregate::reconstitute).flatMap(request -> {
            if (!tenantId.equals(request.getTenantId())) {
                logger.warn("Tenant {} attempted to access request {} of another tenant", tenantId, requestId);
                return Result.failure(CommandError.notFound(requestId));
            }
            return Result.success(request);
        });
    }

    protected void addTimelineEntry(VmRequestAggregate request, TimelineEventType type, String key,
            EventMetadata metadata, String details) {
        bestEffort("add " + type + " timeline entry to " + request.getId(), () ->
            timelineUpdater.addTimelineEvent(new TimelineEntry.Builder()
                .id(TimelineEntry.idFor(type, key))
                .tenantId(request.getTenantId())
                .requestId(request.getId())
                .eventType(type)
                .actorId(metadata.getUserId())
                .details(details)
                .occurredAt(metadata.getTimestamp())
                .build()));
    }
}
