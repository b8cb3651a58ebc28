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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Authenticated connection of one tenant, cached by {@link HypervisorSessionManager}. The session owns its keepalive
 * task and cancels it when closed.
 */
public class HypervisorSession {
    private static final Logger logger = LoggerFactory.getLogger(HypervisorSession.class);

    private final String tenantId;
    private final HypervisorConnection connection;
    private final Instant createdAt;
    private volatile ScheduledFuture<?> keepAlive;
    private volatile boolean closed;

    HypervisorSession(String tenantId, HypervisorConnection connection, Instant createdAt) {
        this.tenantId = tenantId;
        this.connection = connection;
        this.createdAt = createdAt;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getApiVersion() {
        return connection.apiVersion();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isClosed() {
        return closed;
    }

    HypervisorConnection connection() {
        return connection;
    }

    void keepAlive(ScheduledFuture<?> task) {
        this.keepAlive = task;
        if (closed) {
            task.cancel(false);
        }
    }

    boolean hasKeepAlive() {
        ScheduledFuture<?> task = keepAlive;
        return task != null && !task.isDone();
    }

    /**
     * Cancel keepalive and log out. Failure to log out is only logged, the session is unusable anyway.
     */
    synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        ScheduledFuture<?> task = keepAlive;
        if (task != null) {
            task.cancel(false);
        }
        try {
            connection.logout();
        } catch (HypervisorBindingException | RuntimeException e) {
            logger.warn("Logout of tenant {} failed: {}", tenantId, e.getMessage());
        }
    }
}
