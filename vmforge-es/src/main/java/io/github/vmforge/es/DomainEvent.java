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

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * An immutable fact that happened to an aggregate. Events are the only source of aggregate state.
 * <p>Events do not carry their own sequence number, it is assigned by the {@link io.github.vmforge.es.store.EventStore}
 * during append and is returned back with the {@link io.github.vmforge.es.store.StoredEvent} envelope.</p>
 */
public interface DomainEvent {

    /**
     * Identity of the aggregate this event belongs to.
     * @return aggregate id
     */
    String getAggregateId();

    /**
     * Tenant, actor, correlation and time of this event.
     * @return event metadata
     */
    EventMetadata getMetadata();

    /**
     * Type discriminator of the event. By default simple class name with prefix Immutable and suffix Event stripped.
     * @return type of the event
     */
    @JsonIgnore
    default String getType() {
        return EventType.fromClassStripping(getClass(), "Immutable", "Event");
    }
}
