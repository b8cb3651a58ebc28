package io.github.vmforge.provisioning.application.port;

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

import io.github.vmforge.provisioning.VmForgeStyle;
import org.immutables.value.Value;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry of a request's history as shown to users. The id is derived from the event it describes, so that redelivered
 * events do not produce duplicate entries.
 */
@Value.Immutable
@VmForgeStyle
public interface TimelineEntry {
    UUID getId();

    String getTenantId();

    String getRequestId();

    TimelineEventType getEventType();

    Optional<String> getActorId();

    Optional<String> getDetails();

    Instant getOccurredAt();

    /**
     * Deterministic entry id.
     * @param type type of the entry
     * @param key identity of the fact within that type, e.g. correlation id
     * @return name based UUID of {@code TYPE:key}
     */
    static UUID idFor(TimelineEventType type, String key) {
        return UUID.nameUUIDFromBytes((type.name() + ":" + key).getBytes(StandardCharsets.UTF_8));
    }

    class Builder extends ImmutableTimelineEntry.Builder {

    }
}
