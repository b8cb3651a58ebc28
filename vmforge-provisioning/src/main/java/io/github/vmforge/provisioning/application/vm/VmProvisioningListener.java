package io.github.vmforge.provisioning.application.vm;

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
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestAggregate;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestApprovedEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestStatus;

import java.util.Objects;

/**
 * Triggers provisioning of approved requests. Redelivered approvals are harmless: request that is no longer
 * approved is skipped, and the VM of a request can be started only once.
 */
public class VmProvisioningListener extends CommandHandlerSupport {
    private final ProvisionVmHandler provisionVmHandler;

    public VmProvisioningListener(EventStore eventStore, ProvisionVmHandler provisionVmHandler) {
        super(eventStore);
        this.provisionVmHandler = Objects.requireNonNull(provisionVmHandler, "Provision handler is required");
    }

    /**
     * React to approval of a request.
     * @param event the approval
     * @return started VM, or the reason it was not started
     */
    public Result<CommandResult, CommandError> onApproved(VmRequestApprovedEvent event) {
        String requestId = event.getAggregateId();
        Result<CommandResult, CommandError> result = load(requestId, VmRequestAggregate::reconstitute)
                .flatMap(request -> {
                    if (request.getStatus() != VmRequestStatus.APPROVED) {
                        logger.info("Request {} is {}, provisioning not triggered", requestId, request.getStatus());
                        return Result.success(new CommandResult(requestId, request.getVersion()));
                    }
                    EventMetadata metadata = event.getMetadata().followUp(SYSTEM_ACTOR);
                    return provisionVmHandler.handle(request, metadata);
                });
        result.onFailure(error -> {
            if (error.getKind() == CommandError.Kind.CONCURRENCY_CONFLICT) {
                logger.info("Provisioning of request {} was already started", requestId);
            } else {
                logger.error("Provisioning of request {} could not be triggered: {}", requestId, error);
            }
        });
        return result;
    }
}
