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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Event store decorator publishing appended events to local listeners.
 *
 * <p>Publication happens only after the append succeeded, in registration order of listeners. It is best-effort:
 * a failing listener is logged, the remaining listeners still get the event, and the append result is returned
 * unchanged. Nothing is rolled back. Listeners that need stronger guarantees reconcile from the log.</p>
 */
public class PublishingEventStore implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(PublishingEventStore.class);

    private final EventStore delegate;
    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();

    public PublishingEventStore(EventStore delegate) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate store is required");
    }

    public void subscribe(EventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener is required"));
    }

    public void unsubscribe(EventListener listener) {
        listeners.remove(listener);
    }

    @Override
    public Result<Long, ConcurrencyConflict> append(String aggregateId, List<? extends DomainEvent> events,
            long expectedVersion) throws EventStoreException {
        Result<Long, ConcurrencyConflict> result = delegate.append(aggregateId, events, expectedVersion);
        if (result.isSuccess()) {
            publish(aggregateId, events, expectedVersion);
        }
        return result;
    }

    private void publish(String aggregateId, List<? extends DomainEvent> events, long expectedVersion) {
        long sequence = expectedVersion;
        for (DomainEvent event : events) {
            StoredEvent stored = new StoredEvent(aggregateId, ++sequence, event.getType(), event, event.getMetadata());
            for (EventListener listener : listeners) {
                try {
                    listener.onEvent(stored);
                } catch (Exception e) {
                    logger.error("Listener {} failed to process {} of aggregate {}. Event stays appended.",
                        listener, stored.getEventType(), aggregateId, e);
                }
            }
        }
    }

    @Override
    public List<StoredEvent> loadFrom(String aggregateId, long fromVersion) throws EventStoreException {
        return delegate.loadFrom(aggregateId, fromVersion);
    }

    @Override
    public long currentVersion(String aggregateId) throws EventStoreException {
        return delegate.currentVersion(aggregateId);
    }
}
