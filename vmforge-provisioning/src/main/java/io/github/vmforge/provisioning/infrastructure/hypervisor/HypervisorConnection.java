package io.github.vmforge.provisioning.infrastructure.hypervisor;

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

import io.github.vmforge.provisioning.application.hypervisor.InventoryObject;
import io.github.vmforge.provisioning.application.hypervisor.InventoryType;
import io.github.vmforge.provisioning.application.hypervisor.VmInfo;

import java.util.List;
import java.util.Optional;

/**
 * Authenticated connection of a hypervisor binding. All methods block, callers run them on an I/O executor.
 * Inventory paths have the form {@code datacenter/vm/template}, {@code datacenter/host/cluster} and so on.
 */
public interface HypervisorConnection {
    String apiVersion();

    /**
     * Keep the connection alive.
     * @throws HypervisorBindingException when the connection is no longer usable
     */
    void ping() throws HypervisorBindingException;

    Optional<InventoryObject> findByInventoryPath(String path) throws HypervisorBindingException;

    InventoryObject resourcePoolOf(InventoryObject cluster) throws HypervisorBindingException;

    List<InventoryObject> list(InventoryType type) throws HypervisorBindingException;

    /**
     * Start cloning a template.
     * @param spec what to clone
     * @return id of the clone task
     * @throws HypervisorBindingException when the task cannot be started
     */
    String cloneVm(CloneSpec spec) throws HypervisorBindingException;

    TaskInfo taskInfo(String taskId) throws HypervisorBindingException;

    /**
     * IP address reported by guest tools of a VM.
     * @param vmId the VM
     * @return address, or empty while guest tools did not report one
     * @throws HypervisorBindingException when the VM cannot be queried
     */
    Optional<String> guestIpAddress(String vmId) throws HypervisorBindingException;

    /**
     * @param vmId the VM
     * @return current state of the VM
     * @throws HypervisorBindingException with {@link HypervisorBindingException.Fault#NOT_FOUND} for unknown VM
     */
    VmInfo vmInfo(String vmId) throws HypervisorBindingException;

    /**
     * Start destroying a VM.
     * @param vmId the VM
     * @return id of the destroy task
     * @throws HypervisorBindingException with {@link HypervisorBindingException.Fault#NOT_FOUND} for unknown VM
     */
    String destroyVm(String vmId) throws HypervisorBindingException;

    void logout() throws HypervisorBindingException;
}
