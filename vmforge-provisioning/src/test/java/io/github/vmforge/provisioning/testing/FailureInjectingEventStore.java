package io.github.vmforge.provisioning.testing;

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

import io.github.vmforge.es.DomainEvent;
import io.github.vmforge.es.Result;
import io.github.vmforge.es.store.ConcurrencyConflict;
import io.github.vmforge.es.store.EventStoreException;
import io.github.vmforge.es.store.inmemory.InMemoryEventStore;

import java.sql.SQLException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * In-memory store whose appends of selected event types fail as if the database was down.
 */
public class FailureInjectingEventStore extends InMemoryEventStore {
    private final Set<Class<? extends DomainEvent>> failingTypes = new CopyOnWriteArraySet<>();

    public FailureInjectingEventStore failAppendsOf(Class<? extends DomainEvent> eventType) {
        failingTypes.add(eventType);
        return this;
    }

    public void heal() {
        failingTypes.clear();
    }

    @Override
    public Result<Long, ConcurrencyConflict> append(String aggregateId, List<? extends DomainEvent> events,
            long expectedVersion) throws EventStoreException {
        for (DomainEvent event : events) {
            for (Class<? extends DomainEvent> failing : failingTypes) {
                if (failing.isInstance(event)) {
                    throw EventStoreException.storeFailed(aggregateId, new SQLException("Injected failure"));
                }
            }
        }
        return super.append(aggregateId, events, expectedVersion);
    }
}
