package io.github.vmforge.es.store;

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

import io.github.vmforge.es.DomainEvent;
import io.github.vmforge.es.EventMetadata;

import java.util.Objects;

/**
 * Persisted envelope of an event.
 */
public final class StoredEvent {
    private final String aggregateId;
    private final long sequenceNumber;
    private final String eventType;
    private final DomainEvent payload;
    private final EventMetadata metadata;

    public StoredEvent(String aggregateId, long sequenceNumber, String eventType, DomainEvent payload,
            EventMetadata metadata) {
        this.aggregateId = Objects.requireNonNull(aggregateId);
        this.sequenceNumber = sequenceNumber;
        this.eventType = Objects.requireNonNull(eventType);
        this.payload = Objects.requireNonNull(payload);
        this.metadata = Objects.requireNonNull(metadata);
    }

    public String getAggregateId() {
        return aggregateId;
    }

    /**
     * Position of the event in its stream, starting with 1.
     * @return sequence number
     */
    public long getSequenceNumber() {
        return sequenceNumber;
    }

    public String getEventType() {
        return eventType;
    }

    public DomainEvent getPayload() {
        return payload;
    }

    public EventMetadata getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "StoredEvent{" + aggregateId + "#" + sequenceNumber + " " + eventType + '}';
    }
}
