package io.github.vmforge.provisioning.application.port;

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

import io.github.vmforge.provisioning.application.hypervisor.ProvisioningErrorCode;

/**
 * Sends notifications about requests. Rendering and delivery are up to implementations. Calls are best-effort,
 * callers log failures and carry on.
 */
public interface NotificationSender {
    void sendCreated(RequestNotification notification);

    void sendApproved(RequestNotification notification);

    void sendRejected(RequestNotification notification, String reason);

    void sendVmReady(RequestNotification notification, String hostname, String ipAddress, String warning);

    /**
     * Tell the requester provisioning failed. Only the sanitized message of the code may reach the user.
     * @param notification request data
     * @param errorCode classification of the failure
     */
    void sendProvisioningFailedUser(RequestNotification notification, ProvisioningErrorCode errorCode);

    /**
     * Technical report of a failed provisioning for administrators.
     * @param adminEmail recipient
     * @param notification request data
     * @param errorCode classification of the failure
     * @param retryCount attempts made
     * @param correlationId correlation id to look up logs with
     * @param technicalMessage raw error message
     */
    void sendProvisioningFailedAdmin(String adminEmail, RequestNotification notification,
            ProvisioningErrorCode errorCode, int retryCount, String correlationId, String technicalMessage);
}
