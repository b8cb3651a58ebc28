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
import io.github.vmforge.es.Result;

import java.util.List;

/**
 * Append-only log of events, one stream per aggregate, with optimistic concurrency.
 *
 * <p>Concurrency conflicts are expected outcomes and are returned as values. Exceptions are reserved for failures
 * of the underlying storage.</p>
 */
public interface EventStore {

    /**
     * Atomically append a batch of events to a stream. The batch is written only if the stored version of the stream
     * equals {@code expectedVersion}, stream that does not exist has version 0.
     *
     * @param aggregateId stream to append to
     * @param events events to append, all belonging to the aggregate
     * @param expectedVersion version the caller based its decision on
     * @return new version of the stream, or conflict carrying expected and actual version
     * @throws EventStoreException when storage fails
     */
    Result<Long, ConcurrencyConflict> append(String aggregateId, List<? extends DomainEvent> events,
            long expectedVersion) throws EventStoreException;

    /**
     * Load complete stream in order. Empty list means no such aggregate, interpretation is left to callers.
     * @param aggregateId stream to read
     * @return all events of the stream
     * @throws EventStoreException when storage fails
     */
    default List<StoredEvent> load(String aggregateId) throws EventStoreException {
        return loadFrom(aggregateId, 0);
    }

    /**
     * Load part of the stream with sequence number greater than {@code fromVersion}.
     * @param aggregateId stream to read
     * @param fromVersion version the caller already has
     * @return events newer than fromVersion
     * @throws EventStoreException when storage fails
     */
    List<StoredEvent> loadFrom(String aggregateId, long fromVersion) throws EventStoreException;

    /**
     * Current version of a stream, 0 when it does not exist.
     * @param aggregateId stream
     * @return version
     * @throws EventStoreException when storage fails
     */
    long currentVersion(String aggregateId) throws EventStoreException;
}
