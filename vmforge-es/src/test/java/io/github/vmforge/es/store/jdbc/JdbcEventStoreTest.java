package io.github.vmforge.es.store.jdbc;

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
import io.github.vmforge.es.Result;
import io.github.vmforge.es.TestEvent;
import io.github.vmforge.es.store.ConcurrencyConflict;
import io.github.vmforge.es.store.EventStoreException;
import io.github.vmforge.es.store.StoredEvent;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class JdbcEventStoreTest extends JdbcTest {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStoreTest.class);
    @Rule
    public ErrorCollector collector = new ErrorCollector();

    @Test
    public void events_for_new_aggregate_are_persisted() throws EventStoreException {
        Result<Long, ConcurrencyConflict> result = eventStore.append(name(),
            Arrays.asList(TestEvent.of(name(), 100), TestEvent.of(name(), 200)), 0);
        assertEquals(Long.valueOf(2), result.getValue());
        assertDb(2, "select count(*) from event where aggregate_id = ?", name());
        assertDb(2, "select version from event_version where aggregate_id = ?", name());
    }

    @Test
    public void events_for_existing_aggregate_are_persisted() throws EventStoreException {
        eventStore.append(name(), Arrays.asList(TestEvent.of(name(), 100), TestEvent.of(name(), 200)), 0);
        eventStore.append(name(), Arrays.asList(TestEvent.of(name(), 300), TestEvent.of(name(), 400)), 2);
        assertDb(4, "select count(*) from event where aggregate_id = ?", name());
        assertDb(4, "select version from event_version where aggregate_id = ?", name());
    }

    @Test
    public void conflict_detected_after_insert_rolls_events_back() throws EventStoreException {
        eventStore.append(name(), Collections.singletonList(TestEvent.of(name(), 100)), 0);
        DefaultJdbcSchema racingSchema = new DefaultJdbcSchema("event", "event_version") {
            @Override
            protected PreparedStatement updateAggregateVersion(Connection connection, String aggregateId,
                    long expectedVersion, long newVersion) throws SQLException {
                // as if another writer moved the version between the check and the update
                return super.updateAggregateVersion(connection, aggregateId, expectedVersion + 1, newVersion);
            }
        };
        JdbcEventStore racingStore = new JdbcEventStore(ds, racingSchema, serialization);

        Result<Long, ConcurrencyConflict> result = racingStore.append(name(),
            Arrays.asList(TestEvent.of(name(), 200), TestEvent.of(name(), 300)), 1);

        assertTrue(result.isFailure());
        assertEquals(1, result.getError().getActualVersion());
        assertDb(1, "select count(*) from event where aggregate_id = ?", name());
        assertDb(1, "select version from event_version where aggregate_id = ?", name());
    }

    @Test
    public void stale_version_returns_conflict_and_writes_nothing() throws EventStoreException {
        eventStore.append(name(), Arrays.asList(TestEvent.of(name(), 100), TestEvent.of(name(), 200)), 0);
        Result<Long, ConcurrencyConflict> result = eventStore.append(name(),
            Collections.singletonList(TestEvent.of(name(), 300)), 1);
        assertTrue(result.isFailure());
        assertEquals(1, result.getError().getExpectedVersion());
        assertEquals(2, result.getError().getActualVersion());
        assertDb(2, "select count(*) from event where aggregate_id = ?", name());
    }

    @Test
    public void nonzero_version_of_missing_aggregate_is_conflict() throws EventStoreException {
        Result<Long, ConcurrencyConflict> result = eventStore.append(name(),
            Collections.singletonList(TestEvent.of(name(), 1)), 3);
        assertEquals(new ConcurrencyConflict(name(), 3, 0), result.getError());
        assertDb(0, "select count(*) from event_version where aggregate_id = ?", name());
    }

    @Test
    public void events_and_metadata_are_loaded_in_order() throws EventStoreException {
        EventMetadata metadata = new EventMetadata("tenant-7", "user-7", "corr-7", Instant.parse("2024-03-01T10:15:30Z"));
        eventStore.append(name(), Arrays.asList(new TestEvent(name(), metadata, 1), new TestEvent(name(), metadata, 2),
            new TestEvent(name(), metadata, 3)), 0);

        List<StoredEvent> events = eventStore.load(name());
        assertThat(events, hasSize(3));
        assertEquals(3, events.get(2).getSequenceNumber());
        assertEquals(metadata, events.get(0).getMetadata());
        assertEquals(2, ((TestEvent) events.get(1).getPayload()).getPayload());
        assertThat(eventStore.loadFrom(name(), 1), hasSize(2));
        assertDb(3, "select count(*) from event where aggregate_id = ? and tenant_id = 'tenant-7'", name());
    }

    @Test
    public void appending_unsupported_events_fails() {
        DomainEvent unknown = new DomainEvent() {
            @Override
            public String getAggregateId() {
                return name();
            }

            @Override
            public EventMetadata getMetadata() {
                return EventMetadata.create("t", "u");
            }
        };
        try {
            eventStore.append(name(), Collections.singletonList(unknown), 0);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
            assertDb(0, "select count(*) from event where aggregate_id = ?", name());
        }
    }

    @Test
    public void unknown_stored_type_fails_load() throws EventStoreException {
        eventStore.append(name(), Collections.singletonList(TestEvent.of(name(), 1)), 0);
        template.update("update event set event_type = 'Gone' where aggregate_id = ?", name());
        try {
            eventStore.load(name());
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.SERIALIZATION, e.getFault());
        }
    }

    @Test
    public void concurrent_appends_for_new_aggregate_have_one_winner() throws Exception {
        raceFromVersion(0);
    }

    @Test
    public void concurrent_appends_for_existing_aggregate_have_one_winner() throws Exception {
        eventStore.append(name(), Arrays.asList(TestEvent.of(name(), 1), TestEvent.of(name(), 2)), 0);
        raceFromVersion(2);
    }

    /**
     * Both writers read the aggregate version before either of them writes, so both base their append on the same
     * version.
     */
    private void raceFromVersion(long version) throws InterruptedException {
        CountDownLatch bothHaveReadVersion = new CountDownLatch(2);
        JdbcSchema racingSchema = new DefaultJdbcSchema("event", "event_version") {
            @Override
            protected long readAggregateVersion(ResultSet rs) throws SQLException {
                long read = super.readAggregateVersion(rs);
                awaitOther();
                return read;
            }

            @Override
            protected java.sql.PreparedStatement createAggregateVersion(java.sql.Connection connection,
                    String aggregateId) throws SQLException {
                awaitOther();
                return super.createAggregateVersion(connection, aggregateId);
            }

            private void awaitOther() {
                bothHaveReadVersion.countDown();
                try {
                    if (!bothHaveReadVersion.await(5, TimeUnit.SECONDS)) {
                        logger.info("Writers did not meet before writing");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };
        JdbcEventStore racingStore = new JdbcEventStore(ds, racingSchema, serialization);
        AtomicInteger winners = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        Runnable writer = () -> {
            try {
                Result<Long, ConcurrencyConflict> result = racingStore.append(name(),
                    Collections.singletonList(TestEvent.of(name(), 42)), version);
                if (result.isSuccess()) {
                    winners.incrementAndGet();
                } else {
                    conflicts.incrementAndGet();
                }
            } catch (EventStoreException e) {
                collector.addError(e);
            }
        };
        Thread first = new Thread(writer, "writer-1");
        Thread second = new Thread(writer, "writer-2");
        first.start();
        second.start();
        first.join(20000);
        second.join(20000);

        assertEquals(1, winners.get());
        assertEquals(1, conflicts.get());
        assertDb((int) version + 1, "select count(*) from event where aggregate_id = ?", name());
        assertDb((int) version + 1, "select version from event_version where aggregate_id = ?", name());
    }
}
