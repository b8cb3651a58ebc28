package io.github.vmforge.provisioning.domain.vm;

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

import io.github.vmforge.es.AggregateRoot;
import io.github.vmforge.es.DomainEvent;
import io.github.vmforge.es.EventMetadata;
import io.github.vmforge.es.matching.TypeSwitch;
import io.github.vmforge.provisioning.domain.InvalidStateException;
import io.github.vmforge.provisioning.domain.vmrequest.VmSize;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * A VM being provisioned for an approved request.
 * <pre>
 * CREATED -> CLONING -> CONFIGURING -> POWERING_ON -> WAITING_FOR_NETWORK -> READY
 * any non terminal -> FAILED
 * </pre>
 * Intermediate stages are reported by {@link #updateProgress(ProvisioningStage, EventMetadata)}, which only records
 * monitoring events. {@link #markProvisioned} and {@link #markFailed} are the terminal transitions.
 */
public class VmAggregate extends AggregateRoot {
    private String tenantId;
    private String requestId;
    private String projectId;
    private String projectName;
    private String vmName;
    private VmSize size;
    private String requesterId;
    private String requesterEmail;
    private ProvisioningStage stage;
    private String hypervisorVmId;
    private String ipAddress;
    private String hostname;
    private String warning;
    private String failureReason;
    private String errorCode;

    private final TypeSwitch<DomainEvent> stateUpdater = TypeSwitch.builder(DomainEvent.class)
            .on(VmProvisioningStartedEvent.class, this::started)
            .on(VmProvisioningProgressUpdatedEvent.class, e -> stage = e.getStage())
            .on(VmProvisionedEvent.class, this::provisioned)
            .on(VmProvisioningFailedEvent.class, this::failed)
            .build();

    private VmAggregate(String id) {
        super(id);
    }

    /**
     * Identity of the VM aggregate of a request. Derived from the request, so that at most one VM exists per request.
     * @param requestId id of the request
     * @return VM aggregate id
     */
    public static String idForRequest(String requestId) {
        return UUID.nameUUIDFromBytes(("vm:" + requestId).getBytes(StandardCharsets.UTF_8)).toString();
    }

    public static VmAggregate reconstitute(String id, List<? extends DomainEvent> events) {
        VmAggregate vm = new VmAggregate(id);
        vm.replay(events);
        return vm;
    }

    public static VmAggregate startProvisioning(String requestId, String projectId, String projectName,
            String vmName, VmSize size, String requesterId, String requesterEmail, EventMetadata metadata) {
        VmAggregate vm = new VmAggregate(idForRequest(requestId));
        vm.applyNew(new VmProvisioningStartedEvent.Builder()
                .aggregateId(vm.getId())
                .metadata(metadata)
                .requestId(requestId)
                .projectId(projectId)
                .projectName(projectName)
                .vmName(vmName)
                .size(size)
                .requesterId(requesterId)
                .requesterEmail(requesterEmail)
                .build());
        return vm;
    }

    /**
     * Record that provisioning reached a stage. The same stage may be reported repeatedly, as retried attempts
     * report their stages again. Moving back to an earlier stage is rejected.
     *
     * @param newStage reported stage, neither CREATED nor terminal
     * @param metadata event metadata
     * @throws InvalidStateException when VM is in terminal stage, or the stage would go backwards
     */
    public void updateProgress(ProvisioningStage newStage, EventMetadata metadata) throws InvalidStateException {
        if (stage.isTerminal() || newStage.isTerminal() || newStage == ProvisioningStage.CREATED
                || newStage.ordinal() < stage.ordinal()) {
            throw new InvalidStateException(getId(), stage, "move to " + newStage);
        }
        applyNew(new VmProvisioningProgressUpdatedEvent.Builder()
                .aggregateId(getId())
                .metadata(metadata)
                .stage(newStage)
                .build());
    }

    public void markProvisioned(String hypervisorVmId, String ipAddress, String hostname, String warning,
            EventMetadata metadata) throws InvalidStateException {
        checkNotTerminal("mark provisioned");
        applyNew(new VmProvisionedEvent.Builder()
                .aggregateId(getId())
                .metadata(metadata)
                .hypervisorVmId(hypervisorVmId)
                .ipAddress(ipAddress)
                .hostname(hostname)
                .warning(warning)
                .build());
    }

    public void markFailed(String reason, String errorCode, int retryCount, EventMetadata metadata)
            throws InvalidStateException {
        checkNotTerminal("mark failed");
        applyNew(new VmProvisioningFailedEvent.Builder()
                .aggregateId(getId())
                .metadata(metadata)
                .reason(reason)
                .errorCode(errorCode)
                .retryCount(retryCount)
                .failedAt(metadata.getTimestamp())
                .build());
    }

    private void checkNotTerminal(String operation) throws InvalidStateException {
        if (stage.isTerminal()) {
            throw new InvalidStateException(getId(), stage, operation);
        }
    }

    @Override
    protected void updateState(DomainEvent event) {
        stateUpdater.apply(event);
    }

    private void started(VmProvisioningStartedEvent event) {
        tenantId = event.getMetadata().getTenantId();
        requestId = event.getRequestId();
        projectId = event.getProjectId();
        projectName = event.getProjectName();
        vmName = event.getVmName();
        size = event.getSize();
        requesterId = event.getRequesterId();
        requesterEmail = event.getRequesterEmail();
        stage = ProvisioningStage.CREATED;
    }

    private void provisioned(VmProvisionedEvent event) {
        hypervisorVmId = event.getHypervisorVmId();
        ipAddress = event.getIpAddress().orElse(null);
        hostname = event.getHostname();
        warning = event.getWarning().orElse(null);
        stage = ProvisioningStage.READY;
    }

    private void failed(VmProvisioningFailedEvent event) {
        failureReason = event.getReason();
        errorCode = event.getErrorCode();
        stage = ProvisioningStage.FAILED;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getProjectName() {
        return projectName;
    }

    public String getVmName() {
        return vmName;
    }

    public VmSize getSize() {
        return size;
    }

    public String getRequesterId() {
        return requesterId;
    }

    public String getRequesterEmail() {
        return requesterEmail;
    }

    public ProvisioningStage getStage() {
        return stage;
    }

    public String getHypervisorVmId() {
        return hypervisorVmId;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getHostname() {
        return hostname;
    }

    public String getWarning() {
        return warning;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
