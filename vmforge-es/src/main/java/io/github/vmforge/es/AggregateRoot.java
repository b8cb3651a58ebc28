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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single event sourced aggregate. The aggregate is a consistency boundary, its state is exclusively the fold of
 * its own events.
 *
 * <p>State <strong>can only</strong> change in {@link #updateState(DomainEvent)}. Command methods of subclasses
 * validate their guards against current state and then call {@link #applyNew(DomainEvent)}, which both updates the
 * state and queues the event as uncommitted. The caller is responsible for appending the uncommitted events to an
 * {@link io.github.vmforge.es.store.EventStore} with {@link #getExpectedVersion()} and calling {@link #markCommitted()}
 * once the append succeeded.</p>
 *
 * <p>Aggregates do no I/O. Rehydration from history goes through {@link #replay(List)}, which must be pure: replaying
 * the same events into a fresh instance always yields identical state.</p>
 */
public abstract class AggregateRoot {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final String id;
    private long version;
    private final List<DomainEvent> uncommittedEvents = new ArrayList<>();

    protected AggregateRoot(String id) {
        this.id = Objects.requireNonNull(id, "Aggregate id is required");
    }

    public final String getId() {
        return id;
    }

    /**
     * Version of an aggregate. Equals number of events ever applied to it, committed or not.
     * @return current version
     */
    public final long getVersion() {
        return version;
    }

    /**
     * Version the event store is expected to hold when uncommitted events get appended.
     * @return version before uncommitted events
     */
    public final long getExpectedVersion() {
        return version - uncommittedEvents.size();
    }

    public final List<DomainEvent> getUncommittedEvents() {
        return Collections.unmodifiableList(new ArrayList<>(uncommittedEvents));
    }

    public final boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    /**
     * Clear uncommitted events. Only to be called after they were successfully appended.
     */
    public final void markCommitted() {
        uncommittedEvents.clear();
    }

    /**
     * Apply a new event produced by a command and remember it for append.
     * @param event new event
     */
    protected final void applyNew(DomainEvent event) {
        applyEvent(event);
        uncommittedEvents.add(event);
    }

    /**
     * Fold past events into the state.
     * @param history events in order of their sequence numbers
     */
    protected final void replay(List<? extends DomainEvent> history) {
        for (DomainEvent event : history) {
            applyEvent(event);
        }
    }

    private void applyEvent(DomainEvent event) {
        if (!id.equals(event.getAggregateId())) {
            throw new IllegalArgumentException("Event " + event.getType() + " of aggregate " + event.getAggregateId()
                    + " cannot be applied to " + id);
        }
        updateState(event);
        version++;
        logger.trace("Aggregate {} applied {} reaching version {}", id, event.getType(), version);
    }

    /**
     * Update the state as result of an event. This method must be robust, it may not throw or break state invariants
     * under any input. Failing to do so makes the aggregate irrecoverable.
     *
     * @param event event to apply
     */
    protected abstract void updateState(DomainEvent event);
}
