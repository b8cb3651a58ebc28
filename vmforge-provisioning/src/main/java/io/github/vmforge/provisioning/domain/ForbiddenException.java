package io.github.vmforge.provisioning.domain;

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
 * The acting user is not allowed to perform the operation, independently of the aggregate's state.
 */
public class ForbiddenException extends DomainException {
    private final String userId;

    protected ForbiddenException(String userId, String message) {
        super(message);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }

    /**
     * Separation of duties: requesters cannot decide about their own requests.
     * @param requestId the request
     * @param userId the requester acting as admin
     * @return exception to throw
     */
    public static ForbiddenException selfApproval(String requestId, String userId) {
        return new ForbiddenException(userId, "User " + userId + " cannot approve or reject own request " + requestId);
    }

    public static ForbiddenException notRequester(String requestId, String userId) {
        return new ForbiddenException(userId, "Only the requester can cancel request " + requestId);
    }
}
