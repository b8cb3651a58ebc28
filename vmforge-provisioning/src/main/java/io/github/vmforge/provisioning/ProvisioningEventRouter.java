package io.github.vmforge.provisioning;

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

import io.github.vmforge.es.DomainEvent;
import io.github.vmforge.es.Result;
import io.github.vmforge.es.matching.TypeSwitch;
import io.github.vmforge.es.store.EventListener;
import io.github.vmforge.es.store.StoredEvent;
import io.github.vmforge.provisioning.application.CommandError;
import io.github.vmforge.provisioning.application.CommandResult;
import io.github.vmforge.provisioning.application.vm.ProvisioningSaga;
import io.github.vmforge.provisioning.application.vm.VmProvisioningListener;
import io.github.vmforge.provisioning.application.vmrequest.VmRequestStatusUpdater;
import io.github.vmforge.provisioning.domain.vm.VmProvisioningFailedEvent;
import io.github.vmforge.provisioning.domain.vm.VmProvisioningStartedEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestApprovedEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestReadyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Reacts to appended events by dispatching follow-up work to an executor, so that the thread appending the event
 * is not held up by provisioning.
 *
 * <ul>
 *     <li>approved request starts provisioning of its VM</li>
 *     <li>started provisioning moves the request to {@code PROVISIONING} and then runs the saga</li>
 *     <li>failed provisioning fails the request</li>
 *     <li>ready request is shown as ready in its projection</li>
 * </ul>
 */
public class ProvisioningEventRouter implements EventListener {
    private static final Logger logger = LoggerFactory.getLogger(ProvisioningEventRouter.class);

    private final VmProvisioningListener provisioningListener;
    private final VmRequestStatusUpdater statusUpdater;
    private final ProvisioningSaga saga;
    private final Executor executor;
    private final TypeSwitch<DomainEvent> routes;

    public ProvisioningEventRouter(VmProvisioningListener provisioningListener, VmRequestStatusUpdater statusUpdater,
            ProvisioningSaga saga, Executor executor) {
        this.provisioningListener = Objects.requireNonNull(provisioningListener, "Provisioning listener is required");
        this.statusUpdater = Objects.requireNonNull(statusUpdater, "Status updater is required");
        this.saga = Objects.requireNonNull(saga, "Saga is required");
        this.executor = Objects.requireNonNull(executor, "Executor is required");
        this.routes = TypeSwitch.builder(DomainEvent.class)
                .on(VmRequestApprovedEvent.class, e -> dispatch(e, () -> report(e, provisioningListener.onApproved(e))))
                .on(VmProvisioningStartedEvent.class, e -> dispatch(e, () -> provisioningStarted(e)))
                .on(VmProvisioningFailedEvent.class,
                    e -> dispatch(e, () -> report(e, statusUpdater.onProvisioningFailed(e))))
                .on(VmRequestReadyEvent.class, e -> dispatch(e, () -> report(e, statusUpdater.onRequestReady(e))))
                .build();
    }

    @Override
    public void onEvent(StoredEvent event) {
        routes.apply(event.getPayload());
    }

    private void provisioningStarted(VmProvisioningStartedEvent event) {
        report(event, statusUpdater.onProvisioningStarted(event));
        saga.onProvisioningStarted(event).whenComplete((r, t) -> {
            if (t != null) {
                logger.error("Provisioning saga of VM {} failed", event.getAggregateId(), t);
            }
        });
    }

    private void dispatch(DomainEvent event, Runnable reaction) {
        try {
            executor.execute(() -> {
                try {
                    reaction.run();
                } catch (RuntimeException e) {
                    logger.error("Reaction to {} of {} failed", event.getType(), event.getAggregateId(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.error("Reaction to {} of {} rejected, executor is shut down", event.getType(),
                event.getAggregateId(), e);
        }
    }

    private static void report(DomainEvent event, Result<CommandResult, CommandError> result) {
        result.onFailure(error -> logger.warn("Reaction to {} of {} failed: {}", event.getType(),
            event.getAggregateId(), error));
    }
}
