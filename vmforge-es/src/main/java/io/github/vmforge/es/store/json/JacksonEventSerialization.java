package io.github.vmforge.es.store.json;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.vmforge.es.DomainEvent;
import io.github.vmforge.es.EventMetadata;
import io.github.vmforge.es.EventType;
import io.github.vmforge.es.store.EventSerialization;

import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JSON serialization of events with Jackson. Event classes are registered explicitly under their type name.
 *
 * <p>Events declared as Immutables abstract value types are registered with {@link #registerImmutable(Class)}; their
 * payload is read into the generated implementation class, which follows the {@code Immutable<AbstractType>} naming
 * convention of the package-private style.</p>
 */
public class JacksonEventSerialization implements EventSerialization {
    static final int PAYLOAD_VERSION = 1;

    private final ObjectMapper mapper;
    private final Map<String, Class<? extends DomainEvent>> types = new ConcurrentHashMap<>();

    public JacksonEventSerialization() {
        this(createMapper());
    }

    public JacksonEventSerialization(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new Jdk8Module());
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // allow for future changes in an event
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public JacksonEventSerialization register(String type, Class<? extends DomainEvent> eventClass) {
        types.put(type, eventClass);
        return this;
    }

    public JacksonEventSerialization register(Class<? extends DomainEvent> eventClass) {
        return register(EventType.defaultTypeName(eventClass), eventClass);
    }

    /**
     * Register an abstract Immutables event type. The payload will be read into its generated implementation.
     * @param abstractType abstract value type of the event
     * @return this
     * @throws IllegalArgumentException when implementation class is not present
     */
    public JacksonEventSerialization registerImmutable(Class<? extends DomainEvent> abstractType) {
        String implementation = EventType.immutableImplementationName(abstractType);
        try {
            Class<?> implClass = Class.forName(implementation, true, abstractType.getClassLoader());
            return register(EventType.defaultTypeName(abstractType), implClass.asSubclass(DomainEvent.class));
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Could not find implementation " + implementation + " of event "
                    + abstractType.getName(), e);
        }
    }

    @Override
    public int payloadVersion(DomainEvent event) {
        return PAYLOAD_VERSION;
    }

    @Override
    public String serialize(DomainEvent event) {
        return write(event);
    }

    @Override
    public DomainEvent deserialize(int payloadVersion, String payload, String type) {
        Class<? extends DomainEvent> eventClass = types.get(type);
        if (eventClass == null) {
            throw new IllegalArgumentException("Unknown event type " + type);
        }
        if (payloadVersion != PAYLOAD_VERSION) {
            throw new IllegalArgumentException("Unsupported payload version " + payloadVersion + " of " + type);
        }
        return read(payload, eventClass);
    }

    @Override
    public String serializeMetadata(EventMetadata metadata) {
        return write(metadata);
    }

    @Override
    public EventMetadata deserializeMetadata(String metadata) {
        return read(metadata, EventMetadata.class);
    }

    @Override
    public boolean supports(DomainEvent event) {
        return types.containsKey(event.getType());
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
