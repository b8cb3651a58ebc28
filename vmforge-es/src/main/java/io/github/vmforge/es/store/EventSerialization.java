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

/**
 * Conversion of events into String payloads for stores that persist outside of the JVM heap.
 * <p>During lifetime of the project the serialized form of an event might change. Whenever it changes in incompatible
 * manner, serialization should start using a new payload version for it. Payload version is stored separately by the
 * store and handed back to {@link #deserialize(int, String, String)}, which must be able to read all past versions.</p>
 */
public interface EventSerialization {

    /**
     * Determine version of payload to be used for serialization.
     * @param event event to be serialized
     * @return payload version
     */
    int payloadVersion(DomainEvent event);

    /**
     * Serialize the event into a String payload.
     * @param event event to serialize
     * @return String serialization of the event
     * @throws java.io.UncheckedIOException when event cannot be serialized
     */
    String serialize(DomainEvent event);

    /**
     * Deserialize a payload given its version and type.
     * @param payloadVersion the version of the payload as stored in the store
     * @param payload payload to deserialize
     * @param type type discriminator as stored
     * @return deserialized event
     * @throws java.io.UncheckedIOException when payload cannot be read
     * @throws IllegalArgumentException when type is unknown
     */
    DomainEvent deserialize(int payloadVersion, String payload, String type);

    String serializeMetadata(EventMetadata metadata);

    EventMetadata deserializeMetadata(String metadata);

    /**
     * Whether given event type is known to this serialization.
     * @param event event to check
     * @return true when event can be serialized and read back
     */
    boolean supports(DomainEvent event);
}
