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

import io.github.vmforge.es.store.EventStore;
import io.github.vmforge.es.store.PublishingEventStore;
import io.github.vmforge.provisioning.application.hypervisor.HypervisorPort;
import io.github.vmforge.provisioning.application.port.HypervisorConfigurationRepository;
import io.github.vmforge.provisioning.application.port.NotificationSender;
import io.github.vmforge.provisioning.application.port.ProjectionUpdater;
import io.github.vmforge.provisioning.application.port.ProvisioningProgressRepository;
import io.github.vmforge.provisioning.application.port.TimelineUpdater;
import io.github.vmforge.provisioning.application.reconciliation.ProvisioningReconciler;
import io.github.vmforge.provisioning.application.reconciliation.ReconciliationQueue;
import io.github.vmforge.provisioning.application.vm.ProvisionVmHandler;
import io.github.vmforge.provisioning.application.vm.ProvisioningSaga;
import io.github.vmforge.provisioning.application.vm.ResilientProvisioningService;
import io.github.vmforge.provisioning.application.vm.VmProvisioningListener;
import io.github.vmforge.provisioning.application.vmrequest.ApproveVmRequestHandler;
import io.github.vmforge.provisioning.application.vmrequest.CancelVmRequestHandler;
import io.github.vmforge.provisioning.application.vmrequest.CreateVmRequestHandler;
import io.github.vmforge.provisioning.application.vmrequest.RejectVmRequestHandler;
import io.github.vmforge.provisioning.application.vmrequest.VmRequestStatusUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires command handlers, the provisioning saga and reconciliation around an event store. Events appended through
 * {@link #getEventStore()} drive provisioning of approved requests.
 *
 * <p>Executors passed to the builder stay owned by the caller, the ones created by default are shut down by
 * {@link #shutdown()}.</p>
 */
public class ProvisioningCore {
    private static final Logger logger = LoggerFactory.getLogger(ProvisioningCore.class);

    private final PublishingEventStore eventStore;
    private final ProvisioningProperties properties;
    private final ExecutorService listenerExecutor;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsListenerExecutor;
    private final boolean ownsScheduler;
    private final CreateVmRequestHandler createHandler;
    private final ApproveVmRequestHandler approveHandler;
    private final RejectVmRequestHandler rejectHandler;
    private final CancelVmRequestHandler cancelHandler;
    private final ResilientProvisioningService provisioningService;
    private final ReconciliationQueue reconciliationQueue;
    private final ProvisioningReconciler reconciler;
    private final ProvisioningEventRouter router;

    private ProvisioningCore(Builder b) {
        this.eventStore = new PublishingEventStore(Objects.requireNonNull(b.eventStore, "Event store must be specified"));
        this.properties = b.properties != null ? b.properties : ProvisioningProperties.loadDefaults();
        this.ownsListenerExecutor = b.listenerExecutor == null;
        this.listenerExecutor = ownsListenerExecutor
                ? Executors.newCachedThreadPool(daemonThreads("provisioning-listener"))
                : b.listenerExecutor;
        this.ownsScheduler = b.scheduler == null;
        this.scheduler = ownsScheduler
                ? Executors.newScheduledThreadPool(2, daemonThreads("provisioning-scheduler"))
                : b.scheduler;
        Clock clock = b.clock != null ? b.clock : Clock.systemUTC();
        Objects.requireNonNull(b.hypervisor, "Hypervisor must be specified");
        Objects.requireNonNull(b.configurationRepository, "Configuration repository must be specified");
        Objects.requireNonNull(b.progressRepository, "Progress repository must be specified");
        Objects.requireNonNull(b.projectionUpdater, "Projection updater must be specified");
        Objects.requireNonNull(b.timelineUpdater, "Timeline updater must be specified");
        Objects.requireNonNull(b.notificationSender, "Notification sender must be specified");

        this.createHandler = new CreateVmRequestHandler(eventStore, b.projectionUpdater, b.timelineUpdater,
            b.notificationSender);
        this.approveHandler = new ApproveVmRequestHandler(eventStore, b.projectionUpdater, b.timelineUpdater,
            b.notificationSender);
        this.rejectHandler = new RejectVmRequestHandler(eventStore, b.projectionUpdater, b.timelineUpdater,
            b.notificationSender);
        this.cancelHandler = new CancelVmRequestHandler(eventStore, b.projectionUpdater, b.timelineUpdater,
            b.notificationSender);
        this.provisioningService = new ResilientProvisioningService(b.hypervisor, scheduler,
            properties.getRetrySettings(), properties.getCircuitBreakerSettings());
        this.reconciliationQueue = new ReconciliationQueue();
        this.reconciler = new ProvisioningReconciler(eventStore, reconciliationQueue, scheduler,
            properties.getReconciliationMaxAttempts());
        ProvisioningSaga saga = new ProvisioningSaga(eventStore, b.configurationRepository, provisioningService,
            b.progressRepository, b.timelineUpdater, b.notificationSender, reconciliationQueue,
            properties.getAdminEmail().orElse(null), clock);
        this.router = new ProvisioningEventRouter(
            new VmProvisioningListener(eventStore, new ProvisionVmHandler(eventStore)),
            new VmRequestStatusUpdater(eventStore, b.projectionUpdater), saga, listenerExecutor);
        eventStore.subscribe(router);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Start periodic reconciliation.
     */
    public void start() {
        reconciler.start(properties.getReconciliationInterval());
        logger.info("Provisioning core started with {}, {}", properties.getRetrySettings(),
            properties.getCircuitBreakerSettings());
    }

    /**
     * Stop reacting to events and stop reconciliation. Provisioning in progress is interrupted only when the core
     * owns the executors.
     */
    public void shutdown() {
        eventStore.unsubscribe(router);
        reconciler.stop();
        if (ownsListenerExecutor) {
            listenerExecutor.shutdownNow();
        }
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        logger.info("Provisioning core shut down");
    }

    public EventStore getEventStore() {
        return eventStore;
    }

    public CreateVmRequestHandler getCreateHandler() {
        return createHandler;
    }

    public ApproveVmRequestHandler getApproveHandler() {
        return approveHandler;
    }

    public RejectVmRequestHandler getRejectHandler() {
        return rejectHandler;
    }

    public CancelVmRequestHandler getCancelHandler() {
        return cancelHandler;
    }

    public ResilientProvisioningService getProvisioningService() {
        return provisioningService;
    }

    public ReconciliationQueue getReconciliationQueue() {
        return reconciliationQueue;
    }

    public ProvisioningReconciler getReconciler() {
        return reconciler;
    }

    public static class Builder {
        private EventStore eventStore;
        private HypervisorPort hypervisor;
        private HypervisorConfigurationRepository configurationRepository;
        private ProvisioningProgressRepository progressRepository;
        private ProjectionUpdater projectionUpdater;
        private TimelineUpdater timelineUpdater;
        private NotificationSender notificationSender;
        private ProvisioningProperties properties;
        private ExecutorService listenerExecutor;
        private ScheduledExecutorService scheduler;
        private Clock clock;

        private Builder() {
        }

        public Builder eventStore(EventStore eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        public Builder hypervisor(HypervisorPort hypervisor) {
            this.hypervisor = hypervisor;
            return this;
        }

        public Builder configurationRepository(HypervisorConfigurationRepository configurationRepository) {
            this.configurationRepository = configurationRepository;
            return this;
        }

        public Builder progressRepository(ProvisioningProgressRepository progressRepository) {
            this.progressRepository = progressRepository;
            return this;
        }

        public Builder projectionUpdater(ProjectionUpdater projectionUpdater) {
            this.projectionUpdater = projectionUpdater;
            return this;
        }

        public Builder timelineUpdater(TimelineUpdater timelineUpdater) {
            this.timelineUpdater = timelineUpdater;
            return this;
        }

        public Builder notificationSender(NotificationSender notificationSender) {
            this.notificationSender = notificationSender;
            return this;
        }

        /**
         * Settings to use, {@link ProvisioningProperties#loadDefaults()} when not set.
         * @param properties the settings
         * @return this
         */
        public Builder properties(ProvisioningProperties properties) {
            this.properties = properties;
            return this;
        }

        public Builder listenerExecutor(ExecutorService listenerExecutor) {
            this.listenerExecutor = listenerExecutor;
            return this;
        }

        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ProvisioningCore build() {
            return new ProvisioningCore(this);
        }
    }
}
