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

import io.github.vmforge.es.Result;
import io.github.vmforge.provisioning.application.hypervisor.ConnectionInfo;
import io.github.vmforge.provisioning.application.hypervisor.HypervisorConfiguration;
import io.github.vmforge.provisioning.application.hypervisor.HypervisorError;
import io.github.vmforge.provisioning.application.hypervisor.HypervisorPort;
import io.github.vmforge.provisioning.application.hypervisor.InventoryObject;
import io.github.vmforge.provisioning.application.hypervisor.ProgressListener;
import io.github.vmforge.provisioning.application.hypervisor.ProvisioningResult;
import io.github.vmforge.provisioning.application.hypervisor.ProvisioningSpec;
import io.github.vmforge.provisioning.application.hypervisor.VmInfo;
import io.github.vmforge.provisioning.domain.vm.ProvisioningStage;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Hypervisor port answering {@code createVm} calls from a script, one step per call. When the script runs out, the
 * last step is repeated.
 */
public class ScriptedHypervisor implements HypervisorPort {
    private final Queue<Step> script = new ConcurrentLinkedQueue<>();
    private volatile Step last = (spec, listener) -> answer(Result.failure(HypervisorError.api("Nothing scripted")));
    private final List<ProvisioningSpec> specs = new CopyOnWriteArrayList<>();
    private final List<CompletableFuture<Result<ProvisioningResult, HypervisorError>>> calls =
            new CopyOnWriteArrayList<>();

    @FunctionalInterface
    public interface Step {
        CompletableFuture<Result<ProvisioningResult, HypervisorError>> run(ProvisioningSpec spec,
                ProgressListener listener);
    }

    public static ProvisioningResult vm(String hypervisorVmId, String hostname, String ipAddress) {
        return new ProvisioningResult.Builder()
                .hypervisorVmId(hypervisorVmId)
                .hostname(hostname)
                .ipAddress(ipAddress)
                .build();
    }

    private static CompletableFuture<Result<ProvisioningResult, HypervisorError>> answer(
            Result<ProvisioningResult, HypervisorError> result) {
        return CompletableFuture.completedFuture(result);
    }

    public ScriptedHypervisor then(Step step) {
        script.add(step);
        last = step;
        return this;
    }

    /**
     * Report all stages and succeed.
     * @param result the created VM
     * @return this
     */
    public ScriptedHypervisor thenSucceed(ProvisioningResult result) {
        return then((spec, listener) -> {
            listener.onStage(ProvisioningStage.CLONING);
            listener.onStage(ProvisioningStage.CONFIGURING);
            listener.onStage(ProvisioningStage.POWERING_ON);
            listener.onStage(ProvisioningStage.WAITING_FOR_NETWORK);
            listener.onStage(ProvisioningStage.READY);
            return answer(Result.success(result));
        });
    }

    public ScriptedHypervisor thenFail(HypervisorError error) {
        return then((spec, listener) -> {
            listener.onStage(ProvisioningStage.CLONING);
            return answer(Result.failure(error));
        });
    }

    /**
     * Never answer. The returned future is completed only by the caller, e.g. by cancelling or timing it out.
     * @return this
     */
    public ScriptedHypervisor thenHang() {
        return then((spec, listener) -> new CompletableFuture<>());
    }

    public int getCallCount() {
        return calls.size();
    }

    public List<CompletableFuture<Result<ProvisioningResult, HypervisorError>>> getCalls() {
        return new ArrayList<>(calls);
    }

    public List<ProvisioningSpec> getSpecs() {
        return new ArrayList<>(specs);
    }

    @Override
    public CompletableFuture<Result<ProvisioningResult, HypervisorError>> createVm(ProvisioningSpec spec,
            ProgressListener onProgress) {
        specs.add(spec);
        Step step = script.poll();
        CompletableFuture<Result<ProvisioningResult, HypervisorError>> call =
                (step != null ? step : last).run(spec, onProgress);
        calls.add(call);
        return call;
    }

    private static <T> CompletableFuture<Result<T, HypervisorError>> notScripted() {
        return CompletableFuture.completedFuture(Result.failure(HypervisorError.api("Not scripted", false)));
    }

    @Override
    public CompletableFuture<Result<ConnectionInfo, HypervisorError>> testConnection(
            HypervisorConfiguration configuration, String password) {
        return notScripted();
    }

    @Override
    public CompletableFuture<Result<List<InventoryObject>, HypervisorError>> listDatacenters(String tenantId) {
        return notScripted();
    }

    @Override
    public CompletableFuture<Result<List<InventoryObject>, HypervisorError>> listClusters(String tenantId) {
        return notScripted();
    }

    @Override
    public CompletableFuture<Result<List<InventoryObject>, HypervisorError>> listDatastores(String tenantId) {
        return notScripted();
    }

    @Override
    public CompletableFuture<Result<List<InventoryObject>, HypervisorError>> listNetworks(String tenantId) {
        return notScripted();
    }

    @Override
    public CompletableFuture<Result<List<InventoryObject>, HypervisorError>> listResourcePools(String tenantId) {
        return notScripted();
    }

    @Override
    public CompletableFuture<Result<VmInfo, HypervisorError>> getVm(String tenantId, String hypervisorVmId) {
        return notScripted();
    }

    @Override
    public CompletableFuture<Result<Void, HypervisorError>> deleteVm(String tenantId, String hypervisorVmId) {
        return notScripted();
    }
}
