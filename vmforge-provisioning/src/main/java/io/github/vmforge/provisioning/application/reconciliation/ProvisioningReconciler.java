package io.github.vmforge.provisioning.application.reconciliation;

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
import io.github.vmforge.provisioning.domain.vm.ProvisioningStage;
import io.github.vmforge.provisioning.domain.vm.VmAggregate;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestAggregate;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestStatus;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Repairs requests that stayed in {@code APPROVED} or {@code PROVISIONING} although their VM is ready. The VM
 * aggregate is the source of truth, its facts are copied into the request.
 */
public class ProvisioningReconciler extends CommandHandlerSupport {
    private final ReconciliationQueue queue;
    private final ScheduledExecutorService scheduler;
    private final int maxAttempts;
    private ScheduledFuture<?> schedule;

    public ProvisioningReconciler(EventStore eventStore, ReconciliationQueue queue,
            ScheduledExecutorService scheduler, int maxAttempts) {
        super(eventStore);
        this.queue = Objects.requireNonNull(queue, "Queue is required");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler is required");
        this.maxAttempts = maxAttempts;
    }

    /**
     * Process entries queued so far.
     * @return number of repaired requests
     */
    public int runOnce() {
        List<ReconciliationQueue.Entry> entries = queue.drain();
        int repaired = 0;
        int processed = 0;
        try {
            for (ReconciliationQueue.Entry entry : entries) {
                Result<Boolean, CommandError> outcome = reconcile(entry);
                if (outcome.isSuccess()) {
                    if (outcome.getValue()) {
                        repaired++;
                    }
                } else if (entry.getAttempts() + 1 < maxAttempts) {
                    logger.warn("Reconciliation of {} failed, will retry: {}", entry, outcome.getError());
                    queue.enqueue(entry.retried());
                } else {
                    logger.error("Giving up reconciliation of {}: {}", entry, outcome.getError());
                }
                processed++;
            }
        } finally {
            // entries not processed because of an unexpected failure wait for the next run
            entries.subList(processed, entries.size()).forEach(queue::enqueue);
        }
        return repaired;
    }

    private Result<Boolean, CommandError> reconcile(ReconciliationQueue.Entry entry) {
        return load(entry.getVmId(), VmAggregate::reconstitute).flatMap(vm -> {
            if (vm.getStage() != ProvisioningStage.READY) {
                logger.error("VM {} of request {} is {}, nothing to copy to the request", vm.getId(),
                    entry.getRequestId(), vm.getStage());
                return Result.success(false);
            }
            return load(entry.getRequestId(), VmRequestAggregate::reconstitute).flatMap(request -> {
                VmRequestStatus status = request.getStatus();
                if (status.isTerminal()) {
                    logger.info("Request {} is already {}", request.getId(), status);
                    return Result.success(false);
                }
                if (status != VmRequestStatus.APPROVED && status != VmRequestStatus.PROVISIONING) {
                    logger.error("Request {} is {} although its VM {} is ready", request.getId(), status, vm.getId());
                    return Result.success(false);
                }
                EventMetadata metadata = EventMetadata.create(entry.getTenantId(), SYSTEM_ACTOR,
                    UUID.randomUUID().toString());
                return execute(request, () -> {
                    if (status == VmRequestStatus.APPROVED) {
                        request.markProvisioning(vm.getId(), metadata);
                    }
                    request.markReady(vm.getHypervisorVmId(), vm.getIpAddress(), vm.getHostname(), vm.getWarning(),
                        metadata);
                }).map(version -> {
                        logger.info("Request {} reconciled with VM {}", request.getId(), vm.getId());
                        return true;
                    });
            });
        });
    }

    /**
     * Run reconciliation periodically.
     * @param interval delay between runs
     */
    public synchronized void start(Duration interval) {
        if (schedule != null) {
            throw new IllegalStateException("Reconciliation already started");
        }
        schedule = scheduler.scheduleWithFixedDelay(this::runSafely, interval.toMillis(), interval.toMillis(),
            TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (schedule != null) {
            schedule.cancel(false);
            schedule = null;
        }
    }

    private void runSafely() {
        try {
            int repaired = runOnce();
            if (repaired > 0) {
                logger.info("Reconciled {} request(s)", repaired);
            }
        } catch (RuntimeException e) {
            logger.error("Reconciliation run failed", e);
        }
    }
}
