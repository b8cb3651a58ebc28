package io.github.vmforge.provisioning.testing;

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
import io.github.vmforge.provisioning.application.hypervisor.PowerState;
import io.github.vmforge.provisioning.application.hypervisor.VmInfo;
import io.github.vmforge.provisioning.infrastructure.hypervisor.CloneSpec;
import io.github.vmforge.provisioning.infrastructure.hypervisor.HypervisorBindingException;
import io.github.vmforge.provisioning.infrastructure.hypervisor.HypervisorClient;
import io.github.vmforge.provisioning.infrastructure.hypervisor.HypervisorConnection;
import io.github.vmforge.provisioning.infrastructure.hypervisor.TaskInfo;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Hypervisor binding backed by memory. Inventory is a set of inventory paths, clone tasks finish and guest tools
 * report an IP address after a configurable number of polls.
 */
public class SimulatedHypervisor implements HypervisorClient {
    public static final String API_VERSION = "8.0.2";
    public static final String PASSWORD = "secret";

    private final Set<String> inventory = ConcurrentHashMap.newKeySet();
    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final Map<String, Vm> vms = new ConcurrentHashMap<>();
    private final AtomicInteger ids = new AtomicInteger();
    private final AtomicInteger connects = new AtomicInteger();
    private final AtomicInteger logouts = new AtomicInteger();
    private final AtomicInteger clones = new AtomicInteger();
    private final AtomicInteger taskPolls = new AtomicInteger();

    private volatile int pollsUntilCloned = 2;
    private volatile int pollsUntilIp = 1;
    private volatile HypervisorBindingException.Fault cloneFault;
    private volatile boolean pingFailing;

    /**
     * Add datacenter with cluster, datastore, network, the VM folder and a template.
     * @param datacenter datacenter name
     * @param cluster cluster name
     * @param datastore datastore name
     * @param network network name
     * @param template template name
     * @return this
     */
    public SimulatedHypervisor withInventory(String datacenter, String cluster, String datastore, String network,
            String template) {
        inventory.add(datacenter);
        inventory.add(datacenter + "/host/" + cluster);
        inventory.add(datacenter + "/datastore/" + datastore);
        inventory.add(datacenter + "/network/" + network);
        inventory.add(datacenter + "/vm");
        inventory.add(datacenter + "/vm/" + template);
        return this;
    }

    public SimulatedHypervisor withoutPath(String path) {
        inventory.remove(path);
        return this;
    }

    public SimulatedHypervisor pollsUntilCloned(int polls) {
        this.pollsUntilCloned = polls;
        return this;
    }

    /**
     * Number of polls after which guest tools report the address, negative for never.
     * @param polls number of polls
     * @return this
     */
    public SimulatedHypervisor pollsUntilIp(int polls) {
        this.pollsUntilIp = polls;
        return this;
    }

    public SimulatedHypervisor failClonesWith(HypervisorBindingException.Fault fault) {
        this.cloneFault = fault;
        return this;
    }

    public void setPingFailing(boolean pingFailing) {
        this.pingFailing = pingFailing;
    }

    public int getConnects() {
        return connects.get();
    }

    public int getLogouts() {
        return logouts.get();
    }

    public int getClones() {
        return clones.get();
    }

    public int getTaskPolls() {
        return taskPolls.get();
    }

    public boolean hasVm(String vmId) {
        return vms.containsKey(vmId);
    }

    @Override
    public HypervisorConnection connect(String url, String username, String password)
            throws HypervisorBindingException {
        connects.incrementAndGet();
        if (!PASSWORD.equals(password)) {
            throw HypervisorBindingException.authenticationFailed(url, username);
        }
        return new Connection();
    }

    private static InventoryType typeOf(String path) {
        if (!path.contains("/")) {
            return InventoryType.DATACENTER;
        } else if (path.contains("/host/")) {
            return InventoryType.CLUSTER;
        } else if (path.contains("/datastore/")) {
            return InventoryType.DATASTORE;
        } else if (path.contains("/network/")) {
            return InventoryType.NETWORK;
        } else if (path.contains("/vm/")) {
            return InventoryType.VIRTUAL_MACHINE;
        }
        return InventoryType.FOLDER;
    }

    private static InventoryObject objectAt(String path) {
        return new InventoryObject.Builder()
                .id("obj-" + Integer.toHexString(path.hashCode()))
                .name(path.substring(path.lastIndexOf('/') + 1))
                .type(typeOf(path))
                .build();
    }

    private static class Task {
        final String vmId;
        final int pollsUntilDone;
        final HypervisorBindingException.Fault fault;
        int polls;

        Task(String vmId, int pollsUntilDone, HypervisorBindingException.Fault fault) {
            this.vmId = vmId;
            this.pollsUntilDone = pollsUntilDone;
            this.fault = fault;
        }
    }

    private static class Vm {
        final String name;
        final String ipAddress;
        final int pollsUntilIp;
        int polls;

        Vm(String name, String ipAddress, int pollsUntilIp) {
            this.name = name;
            this.ipAddress = ipAddress;
            this.pollsUntilIp = pollsUntilIp;
        }

        synchronized Optional<String> poll() {
            polls++;
            return pollsUntilIp >= 0 && polls >= pollsUntilIp ? Optional.of(ipAddress) : Optional.empty();
        }
    }

    private class Connection implements HypervisorConnection {
        private volatile boolean loggedOut;

        private void checkSession() throws HypervisorBindingException {
            if (loggedOut) {
                throw new HypervisorBindingException(HypervisorBindingException.Fault.AUTHENTICATION,
                    "Session is not authenticated");
            }
        }

        @Override
        public String apiVersion() {
            return API_VERSION;
        }

        @Override
        public void ping() throws HypervisorBindingException {
            checkSession();
            if (pingFailing) {
                throw new HypervisorBindingException(HypervisorBindingException.Fault.CONNECTION,
                    "Connection reset");
            }
        }

        @Override
        public Optional<InventoryObject> findByInventoryPath(String path) throws HypervisorBindingException {
            checkSession();
            return inventory.contains(path) ? Optional.of(objectAt(path)) : Optional.empty();
        }

        @Override
        public InventoryObject resourcePoolOf(InventoryObject cluster) throws HypervisorBindingException {
            checkSession();
            return new InventoryObject.Builder()
                    .id("pool-" + cluster.getId())
                    .name("Resources")
                    .type(InventoryType.RESOURCE_POOL)
                    .build();
        }

        @Override
        public List<InventoryObject> list(InventoryType type) throws HypervisorBindingException {
            checkSession();
            return inventory.stream()
                    .filter(path -> typeOf(path) == type)
                    .sorted()
                    .map(SimulatedHypervisor::objectAt)
                    .collect(Collectors.toList());
        }

        @Override
        public String cloneVm(CloneSpec spec) throws HypervisorBindingException {
            checkSession();
            int id = ids.incrementAndGet();
            clones.incrementAndGet();
            String vmId = "vm-" + id;
            String taskId = "task-" + id;
            tasks.put(taskId, new Task(vmId, pollsUntilCloned, cloneFault));
            if (cloneFault == null) {
                vms.put(vmId, new Vm(spec.getName(), "10.0.0." + id, pollsUntilIp));
            }
            return taskId;
        }

        @Override
        public TaskInfo taskInfo(String taskId) throws HypervisorBindingException {
            checkSession();
            taskPolls.incrementAndGet();
            Task task = tasks.get(taskId);
            if (task == null) {
                throw HypervisorBindingException.notFound("Task " + taskId);
            }
            TaskInfo.Builder info = new TaskInfo.Builder();
            info.taskId(taskId);
            synchronized (task) {
                task.polls++;
                if (task.polls < task.pollsUntilDone) {
                    info.state(TaskInfo.State.RUNNING);
                } else if (task.fault != null) {
                    info.state(TaskInfo.State.ERROR).errorMessage("Insufficient resources in cluster")
                            .errorFault(task.fault);
                } else {
                    info.state(TaskInfo.State.SUCCESS).result(task.vmId);
                }
            }
            return info.build();
        }

        @Override
        public Optional<String> guestIpAddress(String vmId) throws HypervisorBindingException {
            checkSession();
            Vm vm = vms.get(vmId);
            if (vm == null) {
                throw HypervisorBindingException.notFound("VM " + vmId);
            }
            return vm.poll();
        }

        @Override
        public VmInfo vmInfo(String vmId) throws HypervisorBindingException {
            checkSession();
            Vm vm = vms.get(vmId);
            if (vm == null) {
                throw HypervisorBindingException.notFound("VM " + vmId);
            }
            return new VmInfo.Builder()
                    .id(vmId)
                    .name(vm.name)
                    .powerState(PowerState.POWERED_ON)
                    .ipAddress(vm.ipAddress)
                    .build();
        }

        @Override
        public String destroyVm(String vmId) throws HypervisorBindingException {
            checkSession();
            if (vms.remove(vmId) == null) {
                throw HypervisorBindingException.notFound("VM " + vmId);
            }
            String taskId = "task-" + ids.incrementAndGet();
            tasks.put(taskId, new Task(vmId, 1, null));
            return taskId;
        }

        @Override
        public void logout() {
            loggedOut = true;
            logouts.incrementAndGet();
        }
    }
}
