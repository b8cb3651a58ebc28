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

import java.time.Duration;
import java.util.Objects;

/**
 * Retry policy of provisioning attempts. Delay before attempt {@code n+1} is
 * {@code initialBackoff * multiplier^(n-1)}, capped at {@code maxBackoff}.
 */
public class RetrySettings {
    /**
     * 5 attempts, waiting 10, 20, 40 and 80 seconds in between, each attempt limited to 8 minutes.
     */
    public static final RetrySettings DEFAULT = new RetrySettings(5, Duration.ofSeconds(10), 2.0,
        Duration.ofSeconds(120), Duration.ofMinutes(8));

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;
    private final Duration attemptTimeout;

    /**
     * Create retry settings.
     * @param maxAttempts total number of attempts, including the first one
     * @param initialBackoff delay after first failed attempt
     * @param multiplier growth factor of delays
     * @param maxBackoff upper bound of a single delay
     * @param attemptTimeout hard limit of a single attempt
     */
    public RetrySettings(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff,
            Duration attemptTimeout) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("At least one attempt is required");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier cannot be lower than 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "Initial backoff must be specified");
        this.multiplier = multiplier;
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "Max backoff must be specified");
        this.attemptTimeout = Objects.requireNonNull(attemptTimeout, "Attempt timeout must be specified");
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public Duration getAttemptTimeout() {
        return attemptTimeout;
    }

    @Override
    public String toString() {
        return "RetrySettings{maxAttempts=" + maxAttempts + ", initialBackoff=" + initialBackoff + ", multiplier="
                + multiplier + ", maxBackoff=" + maxBackoff + ", attemptTimeout=" + attemptTimeout + '}';
    }
}
