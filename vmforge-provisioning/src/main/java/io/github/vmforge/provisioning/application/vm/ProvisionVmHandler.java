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
import io.github.vmforge.provisioning.domain.vm.VmAggregate;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestAggregate;

/**
 * Starts provisioning of an approved request by creating its VM aggregate. The VM id is derived from the request
 * id, so second start of the same request ends with {@link CommandError.Kind#CONCURRENCY_CONFLICT}.
 */
public class ProvisionVmHandler extends CommandHandlerSupport {

    public ProvisionVmHandler(EventStore eventStore) {
        super(eventStore);
    }

    public Result<CommandResult, CommandError> handle(VmRequestAggregate request, EventMetadata metadata) {
        VmAggregate vm = VmAggregate.startProvisioning(request.getId(), request.getProjectId(),
            request.getProjectName(), request.getVmName(), request.getSize(), request.getRequesterId(),
            request.getRequesterEmail(), metadata);
        return commit(vm).map(version -> {
            logger.info("Provisioning of VM {} for request {} started", vm.getId(), request.getId());
            return new CommandResult(vm.getId(), version);
        });
    }
}
