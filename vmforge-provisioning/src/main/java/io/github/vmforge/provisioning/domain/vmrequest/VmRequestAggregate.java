package io.github.vmforge.provisioning.domain.vmrequest;

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
import io.github.vmforge.provisioning.domain.ForbiddenException;
import io.github.vmforge.provisioning.domain.InvalidReasonException;
import io.github.vmforge.provisioning.domain.InvalidStateException;
import io.github.vmforge.provisioning.domain.InvalidValueException;

import java.util.List;
import java.util.UUID;

/**
 * Request for a VM and its approval workflow.
 * <pre>
 * PENDING -> APPROVED -> PROVISIONING -> READY
 * PENDING -> REJECTED
 * PENDING, APPROVED -> CANCELLED
 * PROVISIONING -> FAILED
 * </pre>
 * Every transition produces exactly one event.
 */
public class VmRequestAggregate extends AggregateRoot {
    static final int MIN_JUSTIFICATION_LENGTH = 10;

    private String tenantId;
    private String requesterId;
    private String requesterEmail;
    private String projectId;
    private String projectName;
    private String vmName;
    private VmSize size;
    private String justification;
    private VmRequestStatus status;
    private String vmId;
    private String hypervisorVmId;
    private String ipAddress;
    private String hostname;
    private String failureReason;

    private final TypeSwitch<DomainEvent> stateUpdater = TypeSwitch.builder(DomainEvent.class)
            .on(VmRequestCreatedEvent.class, this::created)
            .on(VmRequestApprovedEvent.class, e -> status = VmRequestStatus.APPROVED)
            .on(VmRequestRejectedEvent.class, e -> status = VmRequestStatus.REJECTED)
            .on(VmRequestCancelledEvent.class, e -> status = VmRequestStatus.CANCELLED)
            .on(VmRequestProvisioningStartedEvent.class, this::provisioningStarted)
            .on(VmRequestReadyEvent.class, this::ready)
            .on(VmRequestFailedEvent.class, this::failed)
            .build();

    private VmRequestAggregate(String id) {
        super(id);
    }

    /**
     * Rebuild request from its history.
     * @param id request id
     * @param events complete history
     * @return request in current state
     */
    public static VmRequestAggregate reconstitute(String id, List<? extends DomainEvent> events) {
        VmRequestAggregate request = new VmRequestAggregate(id);
        request.replay(events);
        return request;
    }

    public static VmRequestAggregate create(String requesterEmail, String projectId, String projectName,
            VmName vmName, VmSize size, String justification, EventMetadata metadata) throws InvalidValueException {
        if (justification == null || justification.trim().length() < MIN_JUSTIFICATION_LENGTH) {
            throw new InvalidValueException("justification", "Justification must have at least "
                    + MIN_JUSTIFICATION_LENGTH + " characters");
        }
        if (projectId == null || projectId.trim().isEmpty()) {
            throw new InvalidValueException("projectId", "Project is required");
        }
        VmRequestAggregate request = new VmRequestAggregate(UUID.randomUUID().toString());
        request.applyNew(new VmRequestCreatedEvent.Builder()
                .aggregateId(request.getId())
                .metadata(metadata)
                .requesterId(metadata.getUserId())
                .requesterEmail(requesterEmail == null ? "" : requesterEmail)
                .projectId(projectId)
                .projectName(projectName == null ? "" : projectName)
                .vmName(vmName.getValue())
                .size(size)
                .justification(justification.trim())
                .build());
        return request;
    }

    public void approve(String adminId, EventMetadata metadata) throws ForbiddenException, InvalidStateException {
        checkNotRequester(adminId);
        checkStatus("approve", VmRequestStatus.PENDING);
        applyNew(new VmRequestApprovedEvent.Builder().aggregateId(getId()).metadata(metadata).build());
    }

    public void reject(String adminId, String reason, EventMetadata metadata)
            throws ForbiddenException, InvalidStateException, InvalidReasonException {
        checkNotRequester(adminId);
        checkStatus("reject", VmRequestStatus.PENDING);
        InvalidReasonException.check(reason);
        applyNew(new VmRequestRejectedEvent.Builder().aggregateId(getId()).metadata(metadata).reason(reason.trim())
                .build());
    }

    /**
     * Cancel the request. Repeated cancellation is a no-op.
     * @param userId user cancelling, must be the requester
     * @param reason optional reason
     * @param metadata event metadata
     * @return true if an event was produced
     * @throws ForbiddenException when user is not the requester
     * @throws InvalidStateException when request is past approval
     * @throws InvalidReasonException when reason is longer than {@link InvalidReasonException#MAX_LENGTH}
     */
    public boolean cancel(String userId, String reason, EventMetadata metadata)
            throws ForbiddenException, InvalidStateException, InvalidReasonException {
        if (!requesterId.equals(userId)) {
            throw ForbiddenException.notRequester(getId(), userId);
        }
        if (status == VmRequestStatus.CANCELLED) {
            return false;
        }
        checkStatus("cancel", VmRequestStatus.PENDING, VmRequestStatus.APPROVED);
        InvalidReasonException.checkOptional(reason);
        applyNew(new VmRequestCancelledEvent.Builder().aggregateId(getId()).metadata(metadata).reason(reason)
                .build());
        return true;
    }

    public void markProvisioning(String vmId, EventMetadata metadata) throws InvalidStateException {
        checkStatus("mark provisioning", VmRequestStatus.APPROVED);
        applyNew(new VmRequestProvisioningStartedEvent.Builder().aggregateId(getId()).metadata(metadata).vmId(vmId)
                .build());
    }

    public void markReady(String hypervisorVmId, String ipAddress, String hostname, String warning,
            EventMetadata metadata) throws InvalidStateException {
        checkStatus("mark ready", VmRequestStatus.PROVISIONING);
        applyNew(new VmRequestReadyEvent.Builder()
                .aggregateId(getId())
                .metadata(metadata)
                .hypervisorVmId(hypervisorVmId)
                .ipAddress(ipAddress)
                .hostname(hostname)
                .warning(warning)
                .build());
    }

    public void markFailed(String reason, String errorCode, EventMetadata metadata) throws InvalidStateException {
        checkStatus("mark failed", VmRequestStatus.PROVISIONING);
        applyNew(new VmRequestFailedEvent.Builder()
                .aggregateId(getId())
                .metadata(metadata)
                .reason(reason)
                .errorCode(errorCode)
                .build());
    }

    private void checkNotRequester(String adminId) throws ForbiddenException {
        if (requesterId.equals(adminId)) {
            throw ForbiddenException.selfApproval(getId(), adminId);
        }
    }

    private void checkStatus(String operation, VmRequestStatus... allowed) throws InvalidStateException {
        for (VmRequestStatus candidate : allowed) {
            if (status == candidate) {
                return;
            }
        }
        throw new InvalidStateException(getId(), status, operation);
    }

    @Override
    protected void updateState(DomainEvent event) {
        stateUpdater.apply(event);
    }

    private void created(VmRequestCreatedEvent event) {
        tenantId = event.getMetadata().getTenantId();
        requesterId = event.getRequesterId();
        requesterEmail = event.getRequesterEmail();
        projectId = event.getProjectId();
        projectName = event.getProjectName();
        vmName = event.getVmName();
        size = event.getSize();
        justification = event.getJustification();
        status = VmRequestStatus.PENDING;
    }

    private void provisioningStarted(VmRequestProvisioningStartedEvent event) {
        vmId = event.getVmId();
        status = VmRequestStatus.PROVISIONING;
    }

    private void ready(VmRequestReadyEvent event) {
        hypervisorVmId = event.getHypervisorVmId();
        ipAddress = event.getIpAddress().orElse(null);
        hostname = event.getHostname();
        status = VmRequestStatus.READY;
    }

    private void failed(VmRequestFailedEvent event) {
        failureReason = event.getReason();
        status = VmRequestStatus.FAILED;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getRequesterId() {
        return requesterId;
    }

    public String getRequesterEmail() {
        return requesterEmail;
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

    public String getJustification() {
        return justification;
    }

    public VmRequestStatus getStatus() {
        return status;
    }

    public String getVmId() {
        return vmId;
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

    public String getFailureReason() {
        return failureReason;
    }
}
