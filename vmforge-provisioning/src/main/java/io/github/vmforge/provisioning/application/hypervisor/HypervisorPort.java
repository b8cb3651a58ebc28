package io.github.vmforge.provisioning.application.hypervisor;

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

import io.github.vmforge.es.Result;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Operations on a tenant's hypervisor. All calls are asynchronous, and expected failures complete the future
 * normally with a failed {@link Result}. Cancelling returned futures stops waiting and polling.
 */
public interface HypervisorPort {

    /**
     * Verify connection parameters before they are stored. Does not use or affect cached sessions.
     * @param configuration parameters to verify
     * @param password plain text password
     * @return information about the verified endpoint
     */
    CompletableFuture<Result<ConnectionInfo, HypervisorError>> testConnection(HypervisorConfiguration configuration,
            String password);

    CompletableFuture<Result<List<InventoryObject>, HypervisorError>> listDatacenters(String tenantId);

    CompletableFuture<Result<List<InventoryObject>, HypervisorError>> listClusters(String tenantId);

    CompletableFuture<Result<List<InventoryObject>, HypervisorError>> listDatastores(String tenantId);

    CompletableFuture<Result<List<InventoryObject>, HypervisorError>> listNetworks(String tenantId);

    CompletableFuture<Result<List<InventoryObject>, HypervisorError>> listResourcePools(String tenantId);

    /**
     * Clone a VM from template, power it on and wait for its IP address.
     * @param spec what to create, names the tenant
     * @param onProgress receives stages as they are reached
     * @return created VM, possibly without IP address
     */
    CompletableFuture<Result<ProvisioningResult, HypervisorError>> createVm(ProvisioningSpec spec,
            ProgressListener onProgress);

    CompletableFuture<Result<VmInfo, HypervisorError>> getVm(String tenantId, String hypervisorVmId);

    /**
     * Destroy a VM. VM that does not exist is considered deleted.
     * @param tenantId tenant
     * @param hypervisorVmId id of the VM
     * @return success with no value, or failure
     */
    CompletableFuture<Result<Void, HypervisorError>> deleteVm(String tenantId, String hypervisorVmId);
}
