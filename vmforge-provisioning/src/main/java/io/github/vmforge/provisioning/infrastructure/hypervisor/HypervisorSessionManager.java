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

import io.github.vmforge.es.Result;
import io.github.vmforge.provisioning.application.hypervisor.ConnectionInfo;
import io.github.vmforge.provisioning.application.hypervisor.HypervisorConfiguration;
import io.github.vmforge.provisioning.application.hypervisor.HypervisorError;
import io.github.vmforge.provisioning.application.hypervisor.HypervisorPort;
import io.github.vmforge.provisioning.application.hypervisor.InventoryObject;
import io.github.vmforge.provisioning.application.hypervisor.InventoryType;
import io.github.vmforge.provisioning.application.hypervisor.ProgressListener;
import io.github.vmforge.provisioning.application.hypervisor.ProvisioningErrorCode;
import io.github.vmforge.provisioning.application.hypervisor.ProvisioningResult;
import io.github.vmforge.provisioning.application.hypervisor.ProvisioningSpec;
import io.github.vmforge.provisioning.application.hypervisor.VmInfo;
import io.github.vmforge.provisioning.application.port.CredentialDecryptor;
import io.github.vmforge.provisioning.application.port.HypervisorConfigurationRepository;
import io.github.vmforge.provisioning.domain.vm.ProvisioningStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link HypervisorPort} on top of a {@link HypervisorClient} binding, caching one authenticated session per tenant.
 *
 * <p>Sessions are opened on first use with the tenant's configuration and decrypted credentials, and kept alive by
 * a periodic ping. A session is evicted when its keepalive fails or any call is rejected as unauthenticated; the next
 * call then authenticates again.</p>
 *
 * <p>Binding calls block, so they run on the I/O executor. Waiting for tasks and for guest IP addresses is done by
 * polling driven by the scheduler. Neither of them should be shared with unrelated work.</p>
 */
public class HypervisorSessionManager implements HypervisorPort {
    static final String IP_TIMEOUT_WARNING = "VMware Tools timeout - IP detection pending";

    private static final Logger logger = LoggerFactory.getLogger(HypervisorSessionManager.class);

    private final HypervisorClient client;
    private final HypervisorConfigurationRepository configurationRepository;
    private final CredentialDecryptor credentialDecryptor;
    private final SessionSettings settings;
    private final ExecutorService io;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsExecutors;
    private final Clock clock;
    private final ConcurrentMap<String, HypervisorSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Object> sessionLocks = new ConcurrentHashMap<>();
    private volatile boolean shutdown;

    /**
     * Create session manager using provided executors. The executors are not shut down by {@link #shutdown()}.
     * @param client hypervisor binding
     * @param configurationRepository tenant configurations
     * @param credentialDecryptor decryption of stored passwords
     * @param settings session and polling timing
     * @param io executor for blocking binding calls
     * @param scheduler scheduler for keepalives and polling
     */
    public HypervisorSessionManager(HypervisorClient client, HypervisorConfigurationRepository configurationRepository,
            CredentialDecryptor credentialDecryptor, SessionSettings settings, ExecutorService io,
            ScheduledExecutorService scheduler) {
        this(client, configurationRepository, credentialDecryptor, settings, io, scheduler, Clock.systemUTC());
    }

    /**
     * Create session manager using provided executors and clock. The executors are not shut down by
     * {@link #shutdown()}.
     * @param client hypervisor binding
     * @param configurationRepository tenant configurations
     * @param credentialDecryptor decryption of stored passwords
     * @param settings session and polling timing
     * @param io executor for blocking binding calls
     * @param scheduler scheduler for keepalives and polling
     * @param clock source of session timestamps
     */
    public HypervisorSessionManager(HypervisorClient client, HypervisorConfigurationRepository configurationRepository,
            CredentialDecryptor credentialDecryptor, SessionSettings settings, ExecutorService io,
            ScheduledExecutorService scheduler, Clock clock) {
        this(client, configurationRepository, credentialDecryptor, settings, io, scheduler, clock, false);
    }

    private HypervisorSessionManager(HypervisorClient client,
            HypervisorConfigurationRepository configurationRepository, CredentialDecryptor credentialDecryptor,
            SessionSettings settings, ExecutorService io, ScheduledExecutorService scheduler, Clock clock,
            boolean ownsExecutors) {
        this.client = Objects.requireNonNull(client, "Hypervisor client is required");
        this.configurationRepository = Objects.requireNonNull(configurationRepository,
            "Configuration repository is required");
        this.credentialDecryptor = Objects.requireNonNull(credentialDecryptor, "Credential decryptor is required");
        this.settings = Objects.requireNonNull(settings, "Settings are required");
        this.io = Objects.requireNonNull(io, "I/O executor is required");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler is required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.ownsExecutors = ownsExecutors;
    }

    /**
     * Create session manager with own executors, which are shut down together with it.
     * @param client hypervisor binding
     * @param configurationRepository tenant configurations
     * @param credentialDecryptor decryption of stored passwords
     * @param settings session and polling timing
     * @return new session manager
     */
    public static HypervisorSessionManager create(HypervisorClient client,
            HypervisorConfigurationRepository configurationRepository, CredentialDecryptor credentialDecryptor,
            SessionSettings settings) {
        return new HypervisorSessionManager(client, configurationRepository, credentialDecryptor, settings,
            Executors.newCachedThreadPool(daemonThreads("hypervisor-io")),
            Executors.newScheduledThreadPool(1, daemonThreads("hypervisor-scheduler")), Clock.systemUTC(), true);
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
     * Cached session of the tenant, authenticating a new one when there is none. Blocking.
     * @param tenantId the tenant
     * @return open session
     * @throws HypervisorBindingException when the tenant has no usable configuration or authentication fails
     */
    public HypervisorSession ensureSession(String tenantId) throws HypervisorBindingException {
        HypervisorSession session = sessions.get(tenantId);
        if (session != null) {
            return session;
        }
        synchronized (sessionLocks.computeIfAbsent(tenantId, k -> new Object())) {
            session = sessions.get(tenantId);
            if (session != null) {
                return session;
            }
            if (shutdown) {
                throw new HypervisorBindingException(HypervisorBindingException.Fault.CONNECTION,
                    "Hypervisor session manager is shut down");
            }
            HypervisorConfiguration configuration = configurationRepository.findByTenantId(tenantId)
                    .orElseThrow(() -> new HypervisorBindingException(
                        HypervisorBindingException.Fault.INVALID_CONFIGURATION,
                        "No hypervisor configuration for tenant " + tenantId));
            String password;
            try {
                password = credentialDecryptor.decrypt(configuration.getEncryptedPassword());
            } catch (RuntimeException e) {
                throw new HypervisorBindingException(HypervisorBindingException.Fault.INVALID_CONFIGURATION,
                    "Credentials of tenant " + tenantId + " cannot be decrypted", e);
            }
            HypervisorConnection connection = client.connect(configuration.getUrl(), configuration.getUsername(),
                password);
            HypervisorSession created = new HypervisorSession(tenantId, connection, clock.instant());
            long period = settings.getKeepAliveInterval().toMillis();
            created.keepAlive(scheduler.scheduleAtFixedRate(() -> keepAlive(created), period, period,
                TimeUnit.MILLISECONDS));
            sessions.put(tenantId, created);
            logger.info("Hypervisor session of tenant {} opened at {}, API version {}", tenantId,
                configuration.getUrl(), connection.apiVersion());
            return created;
        }
    }

    /**
     * Cached session of a tenant, without opening one.
     * @param tenantId the tenant
     * @return cached session if any
     */
    public Optional<HypervisorSession> cachedSession(String tenantId) {
        return Optional.ofNullable(sessions.get(tenantId));
    }

    private void keepAlive(HypervisorSession session) {
        try {
            io.execute(() -> {
                try {
                    session.connection().ping();
                    logger.debug("Keepalive of tenant {} succeeded", session.getTenantId());
                } catch (HypervisorBindingException | RuntimeException e) {
                    logger.warn("Keepalive of tenant {} failed, evicting session: {}", session.getTenantId(),
                        e.getMessage());
                    evict(session);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("Keepalive of tenant {} skipped, I/O executor is shut down", session.getTenantId());
        }
    }

    /**
     * Drop cached session of a tenant, cancel its keepalive and log out.
     * @param tenantId the tenant
     */
    public void evict(String tenantId) {
        HypervisorSession session = sessions.remove(tenantId);
        if (session != null) {
            logger.info("Hypervisor session of tenant {} evicted", tenantId);
            session.close();
        }
    }

    private void evict(HypervisorSession session) {
        if (sessions.remove(session.getTenantId(), session)) {
            logger.info("Hypervisor session of tenant {} evicted", session.getTenantId());
        }
        session.close();
    }

    /**
     * Close all sessions. Executors created by {@link #create} are shut down as well.
     */
    public void shutdown() {
        shutdown = true;
        for (String tenantId : sessions.keySet()) {
            evict(tenantId);
        }
        if (ownsExecutors) {
            scheduler.shutdownNow();
            io.shutdownNow();
        }
        logger.info("Hypervisor session manager shut down");
    }

    @Override
    public CompletableFuture<Result<ConnectionInfo, HypervisorError>> testConnection(
            HypervisorConfiguration configuration, String password) {
        return async(null, "test connection to " + configuration.getUrl(), () -> {
            HypervisorConnection connection = client.connect(configuration.getUrl(), configuration.getUsername(),
                password);
            try {
                String dc = configuration.getDatacenterName();
                resolve(connection, dc, "Datacenter", ProvisioningErrorCode.VM_CONFIG_INVALID);
                resolve(connection, dc + "/host/" + configuration.getClusterName(), "Cluster",
                    ProvisioningErrorCode.VM_CONFIG_INVALID);
                resolve(connection, dc + "/datastore/" + configuration.getDatastoreName(), "Datastore",
                    ProvisioningErrorCode.DATASTORE_NOT_AVAILABLE);
                resolve(connection, dc + "/network/" + configuration.getNetworkName(), "Network",
                    ProvisioningErrorCode.NETWORK_CONFIG_FAILED);
                resolve(connection, dc + "/vm/" + configuration.getTemplateName(), "Template",
                    ProvisioningErrorCode.TEMPLATE_NOT_FOUND);
                return new ConnectionInfo.Builder()
                        .apiVersion(connection.apiVersion())
                        .datacenter(dc)
                        .cluster(configuration.getClusterName())
                        .build();
            } finally {
                logoutQuietly(connection, configuration.getUrl());
            }
        });
    }

    @Override
    public CompletableFuture<Result<List<InventoryObject>, HypervisorError>> listDatacenters(String tenantId) {
        return list(tenantId, InventoryType.DATACENTER);
    }

    @Override
    public CompletableFuture<Result<List<InventoryObject>, HypervisorError>> listClusters(String tenantId) {
        return list(tenantId, InventoryType.CLUSTER);
    }

    @Override
    public CompletableFuture<Result<List<InventoryObject>, HypervisorError>> listDatastores(String tenantId) {
        return list(tenantId, InventoryType.DATASTORE);
    }

    @Override
    public CompletableFuture<Result<List<InventoryObject>, HypervisorError>> listNetworks(String tenantId) {
        return list(tenantId, InventoryType.NETWORK);
    }

    @Override
    public CompletableFuture<Result<List<InventoryObject>, HypervisorError>> listResourcePools(String tenantId) {
        return list(tenantId, InventoryType.RESOURCE_POOL);
    }

    private CompletableFuture<Result<List<InventoryObject>, HypervisorError>> list(String tenantId,
            InventoryType type) {
        return async(tenantId, "list " + type, () -> ensureSession(tenantId).connection().list(type));
    }

    @Override
    public CompletableFuture<Result<VmInfo, HypervisorError>> getVm(String tenantId, String hypervisorVmId) {
        return async(tenantId, "get VM " + hypervisorVmId,
            () -> ensureSession(tenantId).connection().vmInfo(hypervisorVmId));
    }

    @Override
    public CompletableFuture<Result<Void, HypervisorError>> deleteVm(String tenantId, String hypervisorVmId) {
        return async(tenantId, "delete VM " + hypervisorVmId, () -> {
            HypervisorConnection connection = ensureSession(tenantId).connection();
            try {
                return Optional.of(connection.destroyVm(hypervisorVmId));
            } catch (HypervisorBindingException e) {
                if (e.getFault() == HypervisorBindingException.Fault.NOT_FOUND) {
                    logger.info("VM {} of tenant {} does not exist, nothing to delete", hypervisorVmId, tenantId);
                    return Optional.<String>empty();
                }
                throw e;
            }
        }).thenCompose(started -> {
            if (started.isFailure() || !started.getValue().isPresent()) {
                return CompletableFuture.<Result<Void, HypervisorError>>completedFuture(
                    started.map(taskId -> (Void) null));
            }
            String taskId = started.getValue().get();
            return Poller.poll(scheduler, io, settings.getTaskPollInterval(), settings.getOperationTimeout(),
                    () -> terminal(ensureSession(tenantId).connection().taskInfo(taskId)))
                    .handle((task, t) -> {
                        if (t != null) {
                            return Result.<Void, HypervisorError>failure(
                                failureOf(tenantId, "delete VM " + hypervisorVmId, t));
                        }
                        if (!task.isPresent()) {
                            return Result.<Void, HypervisorError>failure(HypervisorError.timeout("Deleting VM "
                                    + hypervisorVmId + " did not finish within " + settings.getOperationTimeout()));
                        }
                        if (task.get().getState() == TaskInfo.State.ERROR) {
                            return Result.<Void, HypervisorError>failure(taskError(task.get()));
                        }
                        logger.info("VM {} of tenant {} deleted", hypervisorVmId, tenantId);
                        return Result.<Void, HypervisorError>success(null);
                    });
        });
    }

    @Override
    public CompletableFuture<Result<ProvisioningResult, HypervisorError>> createVm(ProvisioningSpec spec,
            ProgressListener onProgress) {
        return new VmCreation(spec, onProgress).start();
    }

    private static Optional<TaskInfo> terminal(TaskInfo task) {
        return task.getState().isTerminal() ? Optional.of(task) : Optional.empty();
    }

    private static InventoryObject resolve(HypervisorConnection connection, String path, String what,
            ProvisioningErrorCode errorCode) throws HypervisorBindingException {
        Optional<InventoryObject> object = connection.findByInventoryPath(path);
        if (!object.isPresent()) {
            throw new InventoryNotFoundException(what, path, errorCode);
        }
        return object.get();
    }

    private static void logoutQuietly(HypervisorConnection connection, String url) {
        try {
            connection.logout();
        } catch (HypervisorBindingException | RuntimeException e) {
            logger.warn("Logout from {} failed: {}", url, e.getMessage());
        }
    }

    private <T> CompletableFuture<Result<T, HypervisorError>> async(String tenantId, String operation,
            BlockingCall<T> call) {
        CompletableFuture<Result<T, HypervisorError>> promise = new CompletableFuture<>();
        try {
            io.execute(() -> {
                try {
                    promise.complete(Result.success(call.call()));
                } catch (HypervisorBindingException | RuntimeException e) {
                    promise.complete(Result.failure(failureOf(tenantId, operation, e)));
                }
            });
        } catch (RejectedExecutionException e) {
            promise.complete(Result.failure(HypervisorError.connection("Hypervisor session manager is shut down")));
        }
        return promise;
    }

    /**
     * Translate failure of a binding call, evicting the session when the hypervisor no longer accepts it.
     */
    private HypervisorError failureOf(String tenantId, String operation, Throwable t) {
        Throwable cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
        if (!(cause instanceof HypervisorBindingException)) {
            logger.warn("Failed to {}", operation, cause);
            return HypervisorError.api("Unexpected failure: " + cause.getMessage());
        }
        HypervisorBindingException e = (HypervisorBindingException) cause;
        logger.warn("Failed to {}: {} {}", operation, e.getFault(), e.getMessage());
        if (e.getFault() == HypervisorBindingException.Fault.AUTHENTICATION && tenantId != null) {
            evict(tenantId);
        }
        if (e instanceof InventoryNotFoundException) {
            return HypervisorError.notFound(e.getMessage(), ((InventoryNotFoundException) e).getErrorCode());
        }
        return errorOf(e.getFault(), e.getMessage());
    }

    private static HypervisorError errorOf(HypervisorBindingException.Fault fault, String message) {
        switch (fault) {
            case CONNECTION:
                return HypervisorError.connection(message);
            case AUTHENTICATION:
                return HypervisorError.authentication(message);
            case NOT_FOUND:
                return HypervisorError.notFound(message, ProvisioningErrorCode.UNKNOWN);
            case TIMEOUT:
                return HypervisorError.timeout(message);
            case RESOURCE_EXHAUSTED:
                return HypervisorError.resourceExhausted(message);
            case INVALID_CONFIGURATION:
                return HypervisorError.invalidConfiguration(message);
            default:
                return HypervisorError.api(message);
        }
    }

    private static HypervisorError taskError(TaskInfo task) {
        String message = "Task " + task.getTaskId() + " failed: " + task.getErrorMessage().orElse("unknown error");
        return task.getErrorFault()
                .map(fault -> errorOf(fault, message))
                .orElseGet(() -> HypervisorError.provisioning(message, ProvisioningErrorCode.UNKNOWN));
    }

    @FunctionalInterface
    private interface BlockingCall<T> {
        T call() throws HypervisorBindingException;
    }

    /**
     * One attempt to create a VM. Every step checks whether the attempt was not completed meanwhile, e.g. cancelled
     * or timed out by the caller, and stops in that case.
     */
    private class VmCreation {
        private final ProvisioningSpec spec;
        private final ProgressListener listener;
        private final String tenantId;
        private final String operation;
        private final CompletableFuture<Result<ProvisioningResult, HypervisorError>> promise =
                new CompletableFuture<>();
        private volatile HypervisorConnection connection;

        VmCreation(ProvisioningSpec spec, ProgressListener listener) {
            this.spec = spec;
            this.listener = listener;
            this.tenantId = spec.getTenantId();
            this.operation = "create VM " + spec.getName();
        }

        CompletableFuture<Result<ProvisioningResult, HypervisorError>> start() {
            try {
                io.execute(this::cloneTemplate);
            } catch (RejectedExecutionException e) {
                fail(HypervisorError.connection("Hypervisor session manager is shut down"));
            }
            return promise;
        }

        private void cloneTemplate() {
            if (promise.isDone()) {
                return;
            }
            try {
                connection = ensureSession(tenantId).connection();
                String dc = spec.getDatacenterName();
                InventoryObject template = resolve(connection, dc + "/vm/" + spec.getTemplate(), "Template",
                    ProvisioningErrorCode.TEMPLATE_NOT_FOUND);
                InventoryObject datastore = resolve(connection, dc + "/datastore/" + spec.getDatastoreName(),
                    "Datastore", ProvisioningErrorCode.DATASTORE_NOT_AVAILABLE);
                InventoryObject cluster = resolve(connection, dc + "/host/" + spec.getClusterName(), "Cluster",
                    ProvisioningErrorCode.VM_CONFIG_INVALID);
                InventoryObject network = resolve(connection, dc + "/network/" + spec.getNetworkName(), "Network",
                    ProvisioningErrorCode.NETWORK_CONFIG_FAILED);
                InventoryObject folder = resolve(connection,
                    dc + "/vm" + spec.getFolderPath().map(path -> "/" + path).orElse(""), "Folder",
                    ProvisioningErrorCode.VM_CONFIG_INVALID);
                InventoryObject pool = connection.resourcePoolOf(cluster);

                stage(ProvisioningStage.CLONING);
                String taskId = connection.cloneVm(new CloneSpec.Builder()
                        .template(template)
                        .name(spec.getName())
                        .folder(folder)
                        .resourcePool(pool)
                        .datastore(datastore)
                        .network(network)
                        .cpuCores(spec.getCpuCores())
                        .memoryMb(spec.getMemoryMb())
                        .build());
                logger.info("Cloning {} from {} as task {}", spec.getName(), spec.getTemplate(), taskId);
                CompletableFuture<Optional<TaskInfo>> task = Poller.poll(scheduler, io,
                    settings.getTaskPollInterval(), settings.getCloneTimeout(),
                    () -> terminal(connection.taskInfo(taskId)));
                stopWith(task);
                task.whenComplete(this::cloneFinished);
            } catch (HypervisorBindingException | RuntimeException e) {
                fail(failureOf(tenantId, operation, e));
            }
        }

        private void cloneFinished(Optional<TaskInfo> task, Throwable t) {
            if (promise.isDone()) {
                return;
            }
            if (t != null) {
                fail(failureOf(tenantId, operation, t));
            } else if (!task.isPresent()) {
                fail(HypervisorError.timeout("Clone of " + spec.getName() + " did not finish within "
                        + settings.getCloneTimeout()));
            } else if (task.get().getState() == TaskInfo.State.ERROR) {
                fail(taskError(task.get()));
            } else if (!task.get().getResult().isPresent()) {
                fail(HypervisorError.api("Clone task " + task.get().getTaskId() + " did not report the new VM"));
            } else {
                String vmId = task.get().getResult().get();
                logger.info("VM {} cloned as {}", spec.getName(), vmId);
                stage(ProvisioningStage.CONFIGURING);
                stage(ProvisioningStage.POWERING_ON);
                stage(ProvisioningStage.WAITING_FOR_NETWORK);
                CompletableFuture<Optional<String>> ip = Poller.poll(scheduler, io, settings.getIpPollInterval(),
                    settings.getIpTimeout(), () -> connection.guestIpAddress(vmId));
                stopWith(ip);
                ip.whenComplete((address, failure) -> ipDetected(vmId, address, failure));
            }
        }

        private void ipDetected(String vmId, Optional<String> address, Throwable t) {
            if (promise.isDone()) {
                return;
            }
            ProvisioningResult.Builder result = new ProvisioningResult.Builder();
            result.hypervisorVmId(vmId).hostname(spec.getName());
            if (t == null && address.isPresent()) {
                result.ipAddress(address.get());
            } else {
                if (t != null) {
                    logger.warn("IP detection of VM {} failed: {}", vmId, t.getMessage());
                } else {
                    logger.warn("IP address of VM {} not reported within {}", vmId, settings.getIpTimeout());
                }
                result.warning(IP_TIMEOUT_WARNING);
            }
            stage(ProvisioningStage.READY);
            promise.complete(Result.success(result.build()));
        }

        private void stage(ProvisioningStage stage) {
            if (promise.isDone()) {
                return;
            }
            try {
                listener.onStage(stage);
            } catch (RuntimeException e) {
                logger.warn("Progress listener of {} failed on stage {}", spec.getName(), stage, e);
            }
        }

        private void stopWith(CompletableFuture<?> polling) {
            promise.whenComplete((r, t) -> polling.cancel(false));
        }

        private void fail(HypervisorError error) {
            promise.complete(Result.failure(error));
        }
    }
}
