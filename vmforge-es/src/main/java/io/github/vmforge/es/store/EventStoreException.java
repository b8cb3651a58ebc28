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

/**
 * Exception generated when reading or appending events fails for reasons other than optimistic concurrency.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        TX_ERROR, SERIALIZATION, PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventStoreException storeFailed(String aggregateId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Store of aggregate " + aggregateId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException loadFailed(String aggregateId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Load of aggregate " + aggregateId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException serializationFailed(String aggregateId, String type, Throwable cause) {
        return new EventStoreException(Fault.SERIALIZATION, "Event " + type + " of aggregate " + aggregateId
                + " could not be (de)serialized. " + cause.getMessage(), cause);
    }

    public static EventStoreException multipleAggregates(String expected, DomainEvent violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Appended events span multiple aggregates: "
                + expected + " and " + violating.getAggregateId(), null);
    }

    public static EventStoreException unsupported(DomainEvent event) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Unsupported event type: " + event.getType(), null);
    }

    public static EventStoreException emptyAppend(String aggregateId) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Nothing to append to aggregate " + aggregateId,
            null);
    }
}
