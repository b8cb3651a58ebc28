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
import io.github.vmforge.provisioning.application.CommandResult;
import io.github.vmforge.provisioning.application.port.ProjectionUpdater;
import io.github.vmforge.provisioning.domain.DomainException;
import io.github.vmforge.provisioning.domain.vm.VmAggregate;
import io.github.vmforge.provisioning.domain.vm.VmProvisioningFailedEvent;
import io.github.vmforge.provisioning.domain.vm.VmProvisioningStartedEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestAggregate;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestReadyEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestStatus;

import java.util.Objects;

/**
 * Mirrors lifecycle of a VM into status of its request.
 */
public class VmRequestStatusUpdater extends CommandHandlerSupport {
    private final ProjectionUpdater projectionUpdater;

    public VmRequestStatusUpdater(EventStore eventStore, ProjectionUpdater projectionUpdater) {
        super(eventStore);
        this.projectionUpdater = Objects.requireNonNull(projectionUpdater, "Projection updater is required");
    }

    public Result<CommandResult, CommandError> onProvisioningStarted(VmProvisioningStartedEvent event) {
        EventMetadata metadata = event.getMetadata().followUp(SYSTEM_ACTOR);
        return updateRequest(event.getRequestId(), VmRequestStatus.PROVISIONING, request ->
            request.markProvisioning(event.getAggregateId(), metadata));
    }

    public Result<CommandResult, CommandError> onProvisioningFailed(VmProvisioningFailedEvent event) {
        EventMetadata metadata = event.getMetadata().followUp(SYSTEM_ACTOR);
        return load(event.getAggregateId(), VmAggregate::reconstitute)
                .flatMap(vm -> updateRequest(vm.getRequestId(), VmRequestStatus.FAILED, request ->
                    request.markFailed(event.getReason(), event.getErrorCode(), metadata)));
    }

    /**
     * Copy readiness of a request into its projection. The request itself was already marked ready by the saga or
     * by reconciliation.
     * @param event the readiness
     * @return current version of the request
     */
    public Result<CommandResult, CommandError> onRequestReady(VmRequestReadyEvent event) {
        return load(event.getAggregateId(), VmRequestAggregate::reconstitute).map(request -> {
            bestEffort("update projection of " + request.getId(), () ->
                projectionUpdater.updateStatus(request.getTenantId(), request.getId(), request.getStatus(),
                    request.getVersion()));
            return new CommandResult(request.getId(), request.getVersion());
        });
    }

    private Result<CommandResult, CommandError> updateRequest(String requestId, VmRequestStatus status,
            RequestOperation operation) {
        Result<CommandResult, CommandError> result = load(requestId, VmRequestAggregate::reconstitute)
                .flatMap(request -> execute(request, () -> operation.apply(request)).map(version -> {
                    bestEffort("update projection of " + requestId, () ->
                        projectionUpdater.updateStatus(request.getTenantId(), requestId, status, version));
                    return new CommandResult(requestId, version);
                }));
        result.onFailure(error -> logger.warn("Request {} could not be marked {}: {}", requestId, status, error));
        return result;
    }

    @FunctionalInterface
    private interface RequestOperation {
        void apply(VmRequestAggregate request) throws DomainException;
    }
}
