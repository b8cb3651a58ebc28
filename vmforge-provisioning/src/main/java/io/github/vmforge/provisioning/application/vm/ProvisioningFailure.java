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

import io.github.vmforge.provisioning.application.hypervisor.HypervisorError;
import io.github.vmforge.provisioning.application.hypervisor.ProvisioningErrorCode;

import java.util.Objects;

/**
 * Provisioning gave up.
 * <ul>
 *     <li>{@link Kind#EXHAUSTED}: all attempts failed with retriable errors, carries the last one</li>
 *     <li>{@link Kind#PERMANENT}: an attempt failed with error that retrying cannot fix</li>
 *     <li>{@link Kind#UNAVAILABLE}: circuit breaker is open, hypervisor was not called at all</li>
 * </ul>
 */
public final class ProvisioningFailure {

    public enum Kind {
        EXHAUSTED, PERMANENT, UNAVAILABLE
    }

    private final Kind kind;
    private final int attemptCount;
    private final HypervisorError error;

    private ProvisioningFailure(Kind kind, int attemptCount, HypervisorError error) {
        this.kind = kind;
        this.attemptCount = attemptCount;
        this.error = error;
    }

    public static ProvisioningFailure exhausted(int attemptCount, HypervisorError lastError) {
        return new ProvisioningFailure(Kind.EXHAUSTED, attemptCount,
            Objects.requireNonNull(lastError, "Last error is required"));
    }

    public static ProvisioningFailure permanent(int attemptCount, HypervisorError error) {
        return new ProvisioningFailure(Kind.PERMANENT, attemptCount, Objects.requireNonNull(error, "Error is required"));
    }

    public static ProvisioningFailure unavailable() {
        return new ProvisioningFailure(Kind.UNAVAILABLE, 0, null);
    }

    public Kind getKind() {
        return kind;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    /**
     * The error that ended provisioning. Last error for exhausted retries, the permanent error otherwise.
     * @return the error, null when unavailable
     */
    public HypervisorError getError() {
        return error;
    }

    public ProvisioningErrorCode getErrorCode() {
        return error == null ? ProvisioningErrorCode.CONNECTION_FAILED : error.getErrorCode();
    }

    public String getMessage() {
        switch (kind) {
            case EXHAUSTED:
                return "Provisioning failed after " + attemptCount + " attempts: " + error.getMessage();
            case PERMANENT:
                return "Provisioning failed: " + error.getMessage();
            default:
                return "Hypervisor temporarily unavailable, circuit breaker is open";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProvisioningFailure)) {
            return false;
        }
        ProvisioningFailure that = (ProvisioningFailure) o;
        return kind == that.kind && attemptCount == that.attemptCount && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, attemptCount, error);
    }

    @Override
    public String toString() {
        return "ProvisioningFailure{" + kind + ", attempts=" + attemptCount + ", error=" + error + '}';
    }
}
