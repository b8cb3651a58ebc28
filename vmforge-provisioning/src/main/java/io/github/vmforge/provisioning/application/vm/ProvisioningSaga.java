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
import io.github.vmforge.provisioning.application.hypervisor.HypervisorConfiguration;
import io.github.vmforge.provisioning.application.hypervisor.ProvisioningErrorCode;
import io.github.vmforge.provisioning.application.hypervisor.ProvisioningResult;
import io.github.vmforge.provisioning.application.hypervisor.ProvisioningSpec;
import io.github.vmforge.provisioning.application.port.HypervisorConfigurationRepository;
import io.github.vmforge.provisioning.application.port.NotificationSender;
import io.github.vmforge.provisioning.application.port.ProvisioningProgressRepository;
import io.github.vmforge.provisioning.application.port.RequestNotification;
import io.github.vmforge.provisioning.application.port.TimelineEntry;
import io.github.vmforge.provisioning.application.port.TimelineEventType;
import io.github.vmforge.provisioning.application.port.TimelineUpdater;
import io.github.vmforge.provisioning.application.reconciliation.ReconciliationQueue;
import io.github.vmforge.provisioning.domain.vm.ProvisioningStage;
import io.github.vmforge.provisioning.domain.vm.VmAggregate;
import io.github.vmforge.provisioning.domain.vm.VmProvisioningStartedEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestAggregate;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Drives provisioning of a VM once it was started, from the hypervisor call up to updating the request.
 *
 * <p>There is no transaction spanning the steps. Every step commits on its own and failure of a later step does not
 * undo earlier ones: when the VM got provisioned but the request could not be marked ready, the VM stays provisioned,
 * the inconsistency is logged and queued for the {@link ReconciliationQueue reconciliation}. Timeline entries and
 * notifications are best-effort.</p>
 *
 * <p>Log statements of the saga carry {@code correlationId} and {@code tenantId} in the MDC.</p>
 */
public class ProvisioningSaga extends CommandHandlerSupport {
    static final String FALLBACK_PREFIX = "VM";
    private static final int PREFIX_LENGTH = 4;

    private final HypervisorConfigurationRepository configurationRepository;
    private final ResilientProvisioningService provisioningService;
    private final ProvisioningProgressRepository progressRepository;
    private final TimelineUpdater timelineUpdater;
    private final NotificationSender notificationSender;
    private final ReconciliationQueue reconciliationQueue;
    private final String adminEmail;
    private final Clock clock;

    /**
     * Create the saga.
     * @param eventStore event store
     * @param configurationRepository tenant hypervisor configurations
     * @param provisioningService resilient hypervisor access
     * @param progressRepository store of transient progress records
     * @param timelineUpdater timeline of requests
     * @param notificationSender notifications to users and admins
     * @param reconciliationQueue queue of requests that need reconciliation
     * @param adminEmail recipient of technical failure reports, or null not to send them
     * @param clock clock for progress timestamps
     */
    public ProvisioningSaga(EventStore eventStore, HypervisorConfigurationRepository configurationRepository,
            ResilientProvisioningService provisioningService, ProvisioningProgressRepository progressRepository,
            TimelineUpdater timelineUpdater, NotificationSender notificationSender,
            ReconciliationQueue reconciliationQueue, String adminEmail, Clock clock) {
        super(eventStore);
        this.configurationRepository = Objects.requireNonNull(configurationRepository,
            "Configuration repository is required");
        this.provisioningService = Objects.requireNonNull(provisioningService, "Provisioning service is required");
        this.progressRepository = Objects.requireNonNull(progressRepository, "Progress repository is required");
        this.timelineUpdater = Objects.requireNonNull(timelineUpdater, "Timeline updater is required");
        this.notificationSender = Objects.requireNonNull(notificationSender, "Notification sender is required");
        this.reconciliationQueue = Objects.requireNonNull(reconciliationQueue, "Reconciliation queue is required");
        this.adminEmail = adminEmail;
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    /**
     * Prefix of hypervisor VM names derived from project name: its first four alphanumeric characters in upper case,
     * {@code VM} when it has none.
     * @param projectName display name of the project
     * @return the prefix
     */
    public static String namePrefix(String projectName) {
        StringBuilder prefix = new StringBuilder(PREFIX_LENGTH);
        if (projectName != null) {
            for (int i = 0; i < projectName.length() && prefix.length() < PREFIX_LENGTH; i++) {
                char c = projectName.charAt(i);
                if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
                    prefix.append(c);
                }
            }
        }
        return prefix.length() == 0 ? FALLBACK_PREFIX : prefix.toString().toUpperCase(Locale.ROOT);
    }

    /**
     * Provision the VM whose provisioning just started.
     * @param event start of the provisioning
     * @return completes when the saga finished, never exceptionally
     */
    public CompletableFuture<Void> onProvisioningStarted(VmProvisioningStartedEvent event) {
        Context ctx = new Context(event);
        try (MDC.MDCCloseable c = MDC.putCloseable("correlationId", ctx.metadata.getCorrelationId());
             MDC.MDCCloseable t = MDC.putCloseable("tenantId", ctx.metadata.getTenantId())) {
            logger.info("Provisioning saga of VM {} for request {} started", ctx.vmId, ctx.requestId);
            Optional<HypervisorConfiguration> configuration =
                    configurationRepository.findByTenantId(ctx.metadata.getTenantId());
            if (!configuration.isPresent()) {
                logger.warn("Tenant {} has no hypervisor configuration", ctx.metadata.getTenantId());
                provisioningFailed(ctx, ProvisioningErrorCode.VM_CONFIG_INVALID,
                    "No hypervisor configuration for tenant " + ctx.metadata.getTenantId(), 0);
                return CompletableFuture.completedFuture(null);
            }
            ProvisioningSpec spec = specOf(event, configuration.get());
            return provisioningService.createVmWithRetry(spec, ctx.metadata.getCorrelationId(),
                    stage -> inContext(ctx, () -> stageReached(ctx, stage)))
                    .handle((result, failure) -> {
                        inContext(ctx, () -> finish(ctx, result, failure));
                        return null;
                    });
        }
    }

    private ProvisioningSpec specOf(VmProvisioningStartedEvent event, HypervisorConfiguration configuration) {
        return new ProvisioningSpec.Builder()
                .tenantId(event.getMetadata().getTenantId())
                .name(namePrefix(event.getProjectName()) + "-" + event.getVmName())
                .template(configuration.getTemplateName())
                .cpuCores(event.getSize().getCpuCores())
                .memoryMb(event.getSize().getMemoryMb())
                .datacenterName(configuration.getDatacenterName())
                .clusterName(configuration.getClusterName())
                .datastoreName(configuration.getDatastoreName())
                .networkName(configuration.getNetworkName())
                .folderPath(configuration.getFolderPath())
                .build();
    }

    private void stageReached(Context ctx, ProvisioningStage stage) {
        bestEffort("save progress of " + ctx.vmId, () -> progressRepository.save(ctx.progress.reached(stage)));
        if (stage.isTerminal()) {
            return;
        }
        Result<Long, CommandError> updated = load(ctx.vmId, VmAggregate::reconstitute)
                .flatMap(vm -> execute(vm, () -> vm.updateProgress(stage, ctx.followUp())));
        updated.onFailure(error -> logger.warn("Progress {} of VM {} not recorded: {}", stage, ctx.vmId, error));
    }

    private void finish(Context ctx, Result<ProvisioningResult, ProvisioningFailure> result, Throwable failure) {
        if (failure != null) {
            logger.error("Provisioning of VM {} ended unexpectedly", ctx.vmId, failure);
            provisioningFailed(ctx, ProvisioningErrorCode.UNKNOWN, "Unexpected failure: " + failure.getMessage(), 0);
        } else if (result.isSuccess()) {
            provisioningSucceeded(ctx, result.getValue());
        } else {
            ProvisioningFailure f = result.getError();
            provisioningFailed(ctx, f.getErrorCode(), f.getMessage(), f.getAttemptCount());
        }
    }

    private void provisioningSucceeded(Context ctx, ProvisioningResult vmResult) {
        String ip = vmResult.getIpAddress().orElse(null);
        String warning = vmResult.getWarning().orElse(null);

        Result<VmAggregate, CommandError> provisioned = load(ctx.vmId, VmAggregate::reconstitute)
                .flatMap(vm -> execute(vm, () -> vm.markProvisioned(vmResult.getHypervisorVmId(), ip,
                    vmResult.getHostname(), warning, ctx.followUp())).map(version -> vm));
        if (provisioned.isFailure()) {
            logger.error("VM {} was created as {} but could not be marked provisioned: {}", ctx.vmId,
                vmResult.getHypervisorVmId(), provisioned.getError());
        } else {
            logger.info("VM {} provisioned as {} with IP {}", ctx.vmId, vmResult.getHypervisorVmId(), ip);
        }

        Result<Long, CommandError> ready = load(ctx.requestId, VmRequestAggregate::reconstitute)
                .flatMap(request -> execute(request, () -> request.markReady(vmResult.getHypervisorVmId(), ip,
                    vmResult.getHostname(), warning, ctx.followUp())));
        if (ready.isFailure()) {
            logger.error("Inconsistency between VM {} and request {}: VM is provisioned, request not ready: {}",
                ctx.vmId, ctx.requestId, ready.getError());
            reconciliationQueue.enqueue(ctx.vmId, ctx.requestId, ctx.metadata.getTenantId());
        }

        bestEffort("delete progress of " + ctx.vmId, () ->
            progressRepository.delete(ctx.metadata.getTenantId(), ctx.vmId));
        bestEffort("add VM ready timeline entry of " + ctx.requestId, () ->
            timelineUpdater.addTimelineEvent(new TimelineEntry.Builder()
                .id(TimelineEntry.idFor(TimelineEventType.VM_READY, ctx.vmId))
                .tenantId(ctx.metadata.getTenantId())
                .requestId(ctx.requestId)
                .eventType(TimelineEventType.VM_READY)
                .actorId(SYSTEM_ACTOR)
                .details(vmResult.getHostname() + (ip == null ? "" : " (" + ip + ")"))
                .occurredAt(clock.instant())
                .build()));
        bestEffort("send VM ready notification of " + ctx.requestId, () ->
            notificationSender.sendVmReady(ctx.notification, vmResult.getHostname(), ip, warning));
    }

    private void provisioningFailed(Context ctx, ProvisioningErrorCode errorCode, String message, int retryCount) {
        logger.warn("Provisioning of VM {} failed with {} after {} attempt(s): {}", ctx.vmId, errorCode, retryCount,
            message);
        bestEffort("delete progress of " + ctx.vmId, () ->
            progressRepository.delete(ctx.metadata.getTenantId(), ctx.vmId));

        Result<Long, CommandError> failed = load(ctx.vmId, VmAggregate::reconstitute)
                .flatMap(vm -> execute(vm, () -> vm.markFailed(message, errorCode.name(), retryCount,
                    ctx.followUp())));
        failed.onFailure(error -> logger.error("Failure of VM {} could not be recorded: {}", ctx.vmId, error));

        bestEffort("add provisioning failed timeline entry of " + ctx.requestId, () ->
            timelineUpdater.addTimelineEvent(new TimelineEntry.Builder()
                .id(TimelineEntry.idFor(TimelineEventType.PROVISIONING_FAILED, ctx.metadata.getCorrelationId()))
                .tenantId(ctx.metadata.getTenantId())
                .requestId(ctx.requestId)
                .eventType(TimelineEventType.PROVISIONING_FAILED)
                .actorId(SYSTEM_ACTOR)
                .details(errorCode.getUserMessage())
                .occurredAt(clock.instant())
                .build()));
        bestEffort("notify requester of failed provisioning " + ctx.requestId, () ->
            notificationSender.sendProvisioningFailedUser(ctx.notification, errorCode));
        if (adminEmail != null) {
            bestEffort("notify admin of failed provisioning " + ctx.requestId, () ->
                notificationSender.sendProvisioningFailedAdmin(adminEmail, ctx.notification, errorCode, retryCount,
                    ctx.metadata.getCorrelationId(), message));
        }
    }

    private static void inContext(Context ctx, Runnable action) {
        try (MDC.MDCCloseable c = MDC.putCloseable("correlationId", ctx.metadata.getCorrelationId());
             MDC.MDCCloseable t = MDC.putCloseable("tenantId", ctx.metadata.getTenantId())) {
            action.run();
        }
    }

    /**
     * State of one saga instance.
     */
    private class Context {
        final EventMetadata metadata;
        final String vmId;
        final String requestId;
        final RequestNotification notification;
        final ProgressTracker progress;

        Context(VmProvisioningStartedEvent event) {
            this.metadata = event.getMetadata();
            this.vmId = event.getAggregateId();
            this.requestId = event.getRequestId();
            this.notification = new RequestNotification.Builder()
                    .tenantId(metadata.getTenantId())
                    .requestId(requestId)
                    .requesterEmail(event.getRequesterEmail())
                    .vmName(event.getVmName())
                    .projectName(event.getProjectName())
                    .build();
            this.progress = new ProgressTracker(vmId, requestId, metadata.getTenantId(), clock);
        }

        EventMetadata followUp() {
            return metadata.followUp(SYSTEM_ACTOR);
        }
    }
}
