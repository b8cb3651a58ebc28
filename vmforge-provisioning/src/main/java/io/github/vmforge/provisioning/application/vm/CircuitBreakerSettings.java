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
 * Circuit breaker around provisioning. Counts outcomes of whole retry sequences over a sliding window of recent
 * calls.
 */
public class CircuitBreakerSettings {
    /**
     * Opens after 5 exhausted sequences in a row, probes with 2 calls after 30 seconds.
     */
    public static final CircuitBreakerSettings DEFAULT = new CircuitBreakerSettings(5, 5, 100f,
        Duration.ofSeconds(30), 2);

    private final int slidingWindowSize;
    private final int minimumCalls;
    private final float failureRateThreshold;
    private final Duration openDuration;
    private final int halfOpenCalls;

    public CircuitBreakerSettings(int slidingWindowSize, int minimumCalls, float failureRateThreshold,
            Duration openDuration, int halfOpenCalls) {
        if (failureRateThreshold <= 0 || failureRateThreshold > 100) {
            throw new IllegalArgumentException("Failure rate threshold must be in (0, 100]");
        }
        this.slidingWindowSize = slidingWindowSize;
        this.minimumCalls = minimumCalls;
        this.failureRateThreshold = failureRateThreshold;
        this.openDuration = Objects.requireNonNull(openDuration, "Open duration must be specified");
        this.halfOpenCalls = halfOpenCalls;
    }

    public int getSlidingWindowSize() {
        return slidingWindowSize;
    }

    public int getMinimumCalls() {
        return minimumCalls;
    }

    /**
     * @return percentage of failed calls in the window that opens the breaker
     */
    public float getFailureRateThreshold() {
        return failureRateThreshold;
    }

    public Duration getOpenDuration() {
        return openDuration;
    }

    public int getHalfOpenCalls() {
        return halfOpenCalls;
    }

    @Override
    public String toString() {
        return "CircuitBreakerSettings{window=" + slidingWindowSize + ", minimumCalls=" + minimumCalls
                + ", failureRateThreshold=" + failureRateThreshold + ", openDuration=" + openDuration
                + ", halfOpenCalls=" + halfOpenCalls + '}';
    }
}
