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

/**
 * Failure reported by a hypervisor binding.
 */
public class HypervisorBindingException extends Exception {
    private final Fault fault;

    public enum Fault {
        CONNECTION, AUTHENTICATION, NOT_FOUND, TIMEOUT, RESOURCE_EXHAUSTED, INVALID_CONFIGURATION, API
    }

    public HypervisorBindingException(Fault fault, String message) {
        super(message);
        this.fault = fault;
    }

    public HypervisorBindingException(Fault fault, String message, Throwable cause) {
        super(message, cause);
        this.fault = fault;
    }

    public Fault getFault() {
        return fault;
    }

    public static HypervisorBindingException connectionFailed(String url, Throwable cause) {
        return new HypervisorBindingException(Fault.CONNECTION, "Cannot connect to " + url + ". "
                + (cause == null ? "" : cause.getMessage()), cause);
    }

    public static HypervisorBindingException authenticationFailed(String url, String username) {
        return new HypervisorBindingException(Fault.AUTHENTICATION, "Authentication of " + username + " at " + url
                + " failed");
    }

    public static HypervisorBindingException notFound(String what) {
        return new HypervisorBindingException(Fault.NOT_FOUND, what + " not found");
    }
}
