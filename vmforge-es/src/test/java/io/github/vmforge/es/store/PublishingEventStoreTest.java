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

import io.github.vmforge.es.Result;
import io.github.vmforge.es.TestEvent;
import io.github.vmforge.es.store.inmemory.InMemoryEventStore;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class PublishingEventStoreTest {
    private final PublishingEventStore store = new PublishingEventStore(new InMemoryEventStore());

    @Test
    public void failing_listener_does_not_fail_append() throws EventStoreException {
        List<StoredEvent> received = new ArrayList<>();
        store.subscribe(e -> {
            throw new IllegalStateException("listener is broken");
        });
        store.subscribe(received::add);

        Result<Long, ConcurrencyConflict> result = store.append("a1",
            Arrays.asList(TestEvent.of("a1", 1), TestEvent.of("a1", 2)), 0);

        assertEquals(Long.valueOf(2), result.getValue());
        assertEquals(2, store.load("a1").size());
        assertEquals(2, received.size());
        assertEquals(2, received.get(1).getSequenceNumber());
    }

    @Test
    public void conflicting_append_publishes_nothing() throws EventStoreException {
        store.append("a2", Collections.singletonList(TestEvent.of("a2", 1)), 0);
        List<StoredEvent> received = new ArrayList<>();
        store.subscribe(received::add);

        Result<Long, ConcurrencyConflict> result = store.append("a2",
            Collections.singletonList(TestEvent.of("a2", 2)), 0);

        assertTrue(result.isFailure());
        assertTrue(received.isEmpty());
    }
}
