package io.github.vmforge.es;

/*-
 * #%L
 * vmforge-es
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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Context every event carries: who caused it, on behalf of which tenant, as part of which logical operation, and when.
 * <p>The correlation id ties together all events produced by one user action, including the events the provisioning
 * workflow produces asynchronously afterwards.</p>
 */
public final class EventMetadata {
    private final String tenantId;
    private final String userId;
    private final String correlationId;
    private final Instant timestamp;

    @JsonCreator
    public EventMetadata(@JsonProperty("tenantId") String tenantId, @JsonProperty("userId") String userId,
            @JsonProperty("correlationId") String correlationId, @JsonProperty("timestamp") Instant timestamp) {
        this.tenantId = Objects.requireNonNull(tenantId, "Tenant id is required");
        this.userId = Objects.requireNonNull(userId, "User id is required");
        this.correlationId = Objects.requireNonNull(correlationId, "Correlation id is required");
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp is required");
    }

    public static EventMetadata create(String tenantId, String userId) {
        return new EventMetadata(tenantId, userId, UUID.randomUUID().toString(), Instant.now());
    }

    public static EventMetadata create(String tenantId, String userId, String correlationId) {
        return new EventMetadata(tenantId, userId, correlationId, Instant.now());
    }

    /**
     * Metadata for a follow-up event of the same logical operation, caused by different actor.
     * @param actorId the user or system actor producing the follow-up
     * @return metadata with same tenant and correlation, new actor and current time
     */
    public EventMetadata followUp(String actorId) {
        return new EventMetadata(tenantId, actorId, correlationId, Instant.now());
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getUserId() {
        return userId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventMetadata)) {
            return false;
        }
        EventMetadata that = (EventMetadata) o;
        return tenantId.equals(that.tenantId) && userId.equals(that.userId)
                && correlationId.equals(that.correlationId) && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, userId, correlationId, timestamp);
    }

    @Override
    public String toString() {
        return "EventMetadata{" + "tenantId=" + tenantId + ", userId=" + userId + ", correlationId=" + correlationId
                + ", timestamp=" + timestamp + '}';
    }
}
