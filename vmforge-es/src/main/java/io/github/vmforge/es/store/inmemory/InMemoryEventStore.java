package io.github.vmforge.es.store.inmemory;

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
import io.github.vmforge.es.store.ConcurrencyConflict;
import io.github.vmforge.es.store.EventStore;
import io.github.vmforge.es.store.EventStoreException;
import io.github.vmforge.es.store.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.util.stream.Collectors.toList;

/**
 * Event store keeping the streams in memory. Events are kept as objects, there is no serialization involved.
 * Suitable for tests and single-process deployments without durability requirements.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentMap<String, List<StoredEvent>> storage = new ConcurrentHashMap<>();

    private List<StoredEvent> stream(String aggregateId) {
        return storage.computeIfAbsent(aggregateId, (i) -> new ArrayList<>());
    }

    @Override
    public Result<Long, ConcurrencyConflict> append(String aggregateId, List<? extends DomainEvent> events,
            long expectedVersion) throws EventStoreException {
        checkBatch(aggregateId, events);
        List<StoredEvent> stream = stream(aggregateId);
        // compare and swap happens under the stream's monitor
        synchronized (stream) {
            long actual = stream.size();
            if (actual != expectedVersion) {
                logger.debug("Rejecting append to {}: expected version {}, actual {}", aggregateId, expectedVersion,
                    actual);
                return Result.failure(new ConcurrencyConflict(aggregateId, expectedVersion, actual));
            }
            long sequence = actual;
            for (DomainEvent event : events) {
                stream.add(new StoredEvent(aggregateId, ++sequence, event.getType(), event, event.getMetadata()));
            }
            return Result.success(sequence);
        }
    }

    static void checkBatch(String aggregateId, List<? extends DomainEvent> events) throws EventStoreException {
        if (events.isEmpty()) {
            throw EventStoreException.emptyAppend(aggregateId);
        }
        for (DomainEvent event : events) {
            if (!aggregateId.equals(event.getAggregateId())) {
                throw EventStoreException.multipleAggregates(aggregateId, event);
            }
        }
    }

    @Override
    public List<StoredEvent> loadFrom(String aggregateId, long fromVersion) {
        List<StoredEvent> stream = storage.get(aggregateId);
        if (stream == null) {
            return new ArrayList<>();
        }
        synchronized (stream) {
            return stream.stream().filter(e -> e.getSequenceNumber() > fromVersion).collect(toList());
        }
    }

    @Override
    public long currentVersion(String aggregateId) {
        List<StoredEvent> stream = storage.get(aggregateId);
        if (stream == null) {
            return 0;
        }
        synchronized (stream) {
            return stream.size();
        }
    }
}
