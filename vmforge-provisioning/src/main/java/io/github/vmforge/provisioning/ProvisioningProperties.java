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

import io.github.vmforge.provisioning.application.vm.CircuitBreakerSettings;
import io.github.vmforge.provisioning.application.vm.RetrySettings;
import io.github.vmforge.provisioning.infrastructure.hypervisor.SessionSettings;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Settings of the provisioning core read from {@code vmforge.*} properties. Durations use ISO-8601 notation
 * ({@code PT10S}). Keys that are not present keep their default value.
 */
public class ProvisioningProperties {
    public static final String DEFAULTS_RESOURCE = "/vmforge-defaults.properties";

    static final String PREFIX = "vmforge.";

    private final RetrySettings retrySettings;
    private final CircuitBreakerSettings circuitBreakerSettings;
    private final SessionSettings sessionSettings;
    private final Duration reconciliationInterval;
    private final int reconciliationMaxAttempts;
    private final String adminEmail;

    /**
     * Create properties.
     * @param retrySettings retries of VM creation
     * @param circuitBreakerSettings circuit breaker in front of the hypervisor
     * @param sessionSettings hypervisor sessions and polling
     * @param reconciliationInterval period of reconciliation runs
     * @param reconciliationMaxAttempts how many times an inconsistency is retried before it is dropped
     * @param adminEmail recipient of technical failure reports, or null
     */
    public ProvisioningProperties(RetrySettings retrySettings, CircuitBreakerSettings circuitBreakerSettings,
            SessionSettings sessionSettings, Duration reconciliationInterval, int reconciliationMaxAttempts,
            String adminEmail) {
        this.retrySettings = Objects.requireNonNull(retrySettings, "Retry settings must be specified");
        this.circuitBreakerSettings = Objects.requireNonNull(circuitBreakerSettings,
            "Circuit breaker settings must be specified");
        this.sessionSettings = Objects.requireNonNull(sessionSettings, "Session settings must be specified");
        this.reconciliationInterval = Objects.requireNonNull(reconciliationInterval,
            "Reconciliation interval must be specified");
        if (reconciliationMaxAttempts < 1) {
            throw new IllegalArgumentException("Reconciliation needs at least one attempt");
        }
        this.reconciliationMaxAttempts = reconciliationMaxAttempts;
        this.adminEmail = adminEmail == null || adminEmail.trim().isEmpty() ? null : adminEmail.trim();
    }

    /**
     * Read settings from properties.
     * @param properties properties with {@code vmforge.*} keys
     * @return the settings
     * @throws IllegalArgumentException when a value cannot be parsed or is out of range
     */
    public static ProvisioningProperties load(Properties properties) {
        Reader r = new Reader(properties);
        RetrySettings retry = RetrySettings.DEFAULT;
        CircuitBreakerSettings breaker = CircuitBreakerSettings.DEFAULT;
        SessionSettings session = SessionSettings.DEFAULT;
        return new ProvisioningProperties(
            new RetrySettings(
                r.integer("retry.max-attempts", retry.getMaxAttempts()),
                r.duration("retry.initial-backoff", retry.getInitialBackoff()),
                r.decimal("retry.multiplier", retry.getMultiplier()),
                r.duration("retry.max-backoff", retry.getMaxBackoff()),
                r.duration("retry.attempt-timeout", retry.getAttemptTimeout())),
            new CircuitBreakerSettings(
                r.integer("circuit-breaker.sliding-window-size", breaker.getSlidingWindowSize()),
                r.integer("circuit-breaker.minimum-calls", breaker.getMinimumCalls()),
                (float) r.decimal("circuit-breaker.failure-rate-threshold", breaker.getFailureRateThreshold()),
                r.duration("circuit-breaker.open-duration", breaker.getOpenDuration()),
                r.integer("circuit-breaker.half-open-calls", breaker.getHalfOpenCalls())),
            new SessionSettings(
                r.duration("session.keep-alive-interval", session.getKeepAliveInterval()),
                r.duration("session.task-poll-interval", session.getTaskPollInterval()),
                r.duration("session.clone-timeout", session.getCloneTimeout()),
                r.duration("session.ip-poll-interval", session.getIpPollInterval()),
                r.duration("session.ip-timeout", session.getIpTimeout()),
                r.duration("session.operation-timeout", session.getOperationTimeout())),
            r.duration("reconciliation.interval", Duration.ofMinutes(1)),
            r.integer("reconciliation.max-attempts", 5),
            r.string("notification.admin-email"));
    }

    /**
     * Read settings from {@value #DEFAULTS_RESOURCE} on the classpath, or built-in defaults when it is absent.
     * @return the settings
     */
    public static ProvisioningProperties loadDefaults() {
        Properties properties = new Properties();
        try (InputStream in = ProvisioningProperties.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
        return load(properties);
    }

    public RetrySettings getRetrySettings() {
        return retrySettings;
    }

    public CircuitBreakerSettings getCircuitBreakerSettings() {
        return circuitBreakerSettings;
    }

    public SessionSettings getSessionSettings() {
        return sessionSettings;
    }

    public Duration getReconciliationInterval() {
        return reconciliationInterval;
    }

    public int getReconciliationMaxAttempts() {
        return reconciliationMaxAttempts;
    }

    public Optional<String> getAdminEmail() {
        return Optional.ofNullable(adminEmail);
    }

    private static class Reader {
        private final Properties properties;

        Reader(Properties properties) {
            this.properties = Objects.requireNonNull(properties, "Properties must be specified");
        }

        String string(String key) {
            return properties.getProperty(PREFIX + key);
        }

        private String value(String key) {
            String value = string(key);
            return value == null || value.trim().isEmpty() ? null : value.trim();
        }

        Duration duration(String key, Duration defaultValue) {
            String value = value(key);
            try {
                return value == null ? defaultValue : Duration.parse(value);
            } catch (DateTimeParseException e) {
                throw invalid(key, value, e);
            }
        }

        int integer(String key, int defaultValue) {
            String value = value(key);
            try {
                return value == null ? defaultValue : Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw invalid(key, value, e);
            }
        }

        double decimal(String key, double defaultValue) {
            String value = value(key);
            try {
                return value == null ? defaultValue : Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw invalid(key, value, e);
            }
        }

        private static IllegalArgumentException invalid(String key, String value, Exception cause) {
            return new IllegalArgumentException("Invalid value '" + value + "' of " + PREFIX + key, cause);
        }
    }
}
