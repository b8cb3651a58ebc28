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

import java.time.Duration;
import java.util.Objects;

/**
 * Timing of hypervisor sessions and of polling for results of hypervisor tasks.
 */
public class SessionSettings {
    public static final SessionSettings DEFAULT = new SessionSettings(Duration.ofMinutes(15),
        Duration.ofMillis(500), Duration.ofMinutes(5), Duration.ofSeconds(2), Duration.ofSeconds(120),
        Duration.ofMinutes(2));

    private final Duration keepAliveInterval;
    private final Duration taskPollInterval;
    private final Duration cloneTimeout;
    private final Duration ipPollInterval;
    private final Duration ipTimeout;
    private final Duration operationTimeout;

    /**
     * Create session settings.
     * @param keepAliveInterval period of keepalive pings of cached sessions
     * @param taskPollInterval period of polling hypervisor tasks
     * @param cloneTimeout time a clone task may take
     * @param ipPollInterval period of polling guest tools for IP address
     * @param ipTimeout time to wait for IP address before giving up on it
     * @param operationTimeout time other tasks (destroy) may take
     */
    public SessionSettings(Duration keepAliveInterval, Duration taskPollInterval, Duration cloneTimeout,
            Duration ipPollInterval, Duration ipTimeout, Duration operationTimeout) {
        this.keepAliveInterval = Objects.requireNonNull(keepAliveInterval, "Keepalive interval must be specified");
        this.taskPollInterval = Objects.requireNonNull(taskPollInterval, "Task poll interval must be specified");
        this.cloneTimeout = Objects.requireNonNull(cloneTimeout, "Clone timeout must be specified");
        this.ipPollInterval = Objects.requireNonNull(ipPollInterval, "IP poll interval must be specified");
        this.ipTimeout = Objects.requireNonNull(ipTimeout, "IP timeout must be specified");
        this.operationTimeout = Objects.requireNonNull(operationTimeout, "Operation timeout must be specified");
    }

    public Duration getKeepAliveInterval() {
        return keepAliveInterval;
    }

    public Duration getTaskPollInterval() {
        return taskPollInterval;
    }

    public Duration getCloneTimeout() {
        return cloneTimeout;
    }

    public Duration getIpPollInterval() {
        return ipPollInterval;
    }

    public Duration getIpTimeout() {
        return ipTimeout;
    }

    public Duration getOperationTimeout() {
        return operationTimeout;
    }

    @Override
    public String toString() {
        return "SessionSettings{keepAlive=" + keepAliveInterval + ", taskPoll=" + taskPollInterval + ", clone="
                + cloneTimeout + ", ipPoll=" + ipPollInterval + ", ipTimeout=" + ipTimeout + ", operation="
                + operationTimeout + '}';
    }
}
