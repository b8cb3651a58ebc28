package io.github.vmforge.provisioning.application.hypervisor;

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

import java.util.Objects;

/**
 * Failure of a hypervisor operation. The {@link Kind} tells what went wrong, {@link #isRetriable()} whether trying
 * again may help. Message is technical and is not meant for end users, use {@link #getUserMessage()} for them.
 */
public final class HypervisorError {

    public enum Kind {
        CONNECTION, TIMEOUT, AUTHENTICATION, PROVISIONING, NOT_FOUND, API, RESOURCE_EXHAUSTED, INVALID_CONFIGURATION
    }

    private final Kind kind;
    private final boolean retriable;
    private final ProvisioningErrorCode errorCode;
    private final String message;

    private HypervisorError(Kind kind, boolean retriable, ProvisioningErrorCode errorCode, String message) {
        this.kind = Objects.requireNonNull(kind, "Kind is required");
        this.retriable = retriable;
        this.errorCode = Objects.requireNonNull(errorCode, "Error code is required");
        this.message = message;
    }

    public static HypervisorError connection(String message) {
        return new HypervisorError(Kind.CONNECTION, true, ProvisioningErrorCode.CONNECTION_FAILED, message);
    }

    public static HypervisorError timeout(String message) {
        return new HypervisorError(Kind.TIMEOUT, true, ProvisioningErrorCode.CONNECTION_TIMEOUT, message);
    }

    public static HypervisorError authentication(String message) {
        return new HypervisorError(Kind.AUTHENTICATION, false, ProvisioningErrorCode.CONNECTION_FAILED, message);
    }

    /**
     * Hypervisor rejected the provisioning itself, e.g. because of bad template or resource. Trying again will not
     * change that.
     * @param message technical message
     * @param errorCode user facing classification
     * @return permanent error
     */
    public static HypervisorError provisioning(String message, ProvisioningErrorCode errorCode) {
        return new HypervisorError(Kind.PROVISIONING, false, errorCode, message);
    }

    public static HypervisorError notFound(String message, ProvisioningErrorCode errorCode) {
        return new HypervisorError(Kind.NOT_FOUND, false, errorCode, message);
    }

    public static HypervisorError api(String message) {
        return api(message, true);
    }

    public static HypervisorError api(String message, boolean retriable) {
        return new HypervisorError(Kind.API, retriable, ProvisioningErrorCode.UNKNOWN, message);
    }

    public static HypervisorError resourceExhausted(String message) {
        return new HypervisorError(Kind.RESOURCE_EXHAUSTED, true, ProvisioningErrorCode.INSUFFICIENT_RESOURCES,
            message);
    }

    public static HypervisorError invalidConfiguration(String message) {
        return new HypervisorError(Kind.INVALID_CONFIGURATION, false, ProvisioningErrorCode.VM_CONFIG_INVALID, message);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isRetriable() {
        return retriable;
    }

    public ProvisioningErrorCode getErrorCode() {
        return errorCode;
    }

    public String getMessage() {
        return message;
    }

    public String getUserMessage() {
        return errorCode.getUserMessage();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HypervisorError)) {
            return false;
        }
        HypervisorError that = (HypervisorError) o;
        return kind == that.kind && retriable == that.retriable && errorCode == that.errorCode
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, retriable, errorCode, message);
    }

    @Override
    public String toString() {
        return "HypervisorError{" + kind + (retriable ? ", retriable" : ", permanent") + ", " + errorCode + ": "
                + message + '}';
    }
}
