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

/**
 * Classification of provisioning failures that is safe to show to end users. Technical details of the failure are
 * kept for administrators and logs only.
 */
public enum ProvisioningErrorCode {
    INSUFFICIENT_RESOURCES("The cluster does not have enough capacity for this VM. Please contact your administrator."),
    DATASTORE_NOT_AVAILABLE("The storage for this VM is not available. Please contact your administrator."),
    VM_CONFIG_INVALID("The VM configuration is invalid. Please contact your administrator."),
    CONNECTION_FAILED("The virtualization platform could not be reached. Please try again later."),
    TEMPLATE_NOT_FOUND("The VM template is not available. Please contact your administrator."),
    NETWORK_CONFIG_FAILED("The network of the VM could not be configured. Please contact your administrator."),
    VMWARE_TOOLS_TIMEOUT("The VM was created, but its IP address could not be detected yet."),
    CONNECTION_TIMEOUT("The virtualization platform did not respond in time. Please try again later."),
    UNKNOWN("An unexpected error occurred during provisioning. Please contact your administrator.");

    private final String userMessage;

    ProvisioningErrorCode(String userMessage) {
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
