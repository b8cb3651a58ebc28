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
import io.github.vmforge.es.store.ConcurrencyConflict;
import io.github.vmforge.es.store.EventSerialization;
import io.github.vmforge.es.store.EventStore;
import io.github.vmforge.es.store.EventStoreException;
import io.github.vmforge.es.store.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.UncheckedIOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Event store persisting the streams into relational database.
 *
 * <p>Append of a batch happens in single transaction. The version table row of the aggregate acts as the compare and
 * swap cell: it is read, events are inserted, and the row is updated with condition on the expected version. If any
 * of those steps observes a different version (including duplicate key of a concurrent writer), the transaction is
 * rolled back and {@link ConcurrencyConflict} with freshly read actual version is returned.</p>
 */
public class JdbcEventStore implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final EventSerialization serialization;

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, EventSerialization serialization) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.serialization = serialization;
    }

    @Override
    public Result<Long, ConcurrencyConflict> append(String aggregateId, List<? extends DomainEvent> events,
            long expectedVersion) throws EventStoreException {
        AppendTemplate template = new AppendTemplate(aggregateId, expectedVersion);
        for (DomainEvent event : events) {
            template.addEvent(event);
        }
        return template.append();
    }

    @Override
    public List<StoredEvent> loadFrom(String aggregateId, long fromVersion) throws EventStoreException {
        List<StoredEvent> result = new ArrayList<>();
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = schema.selectEvents(connection, aggregateId, fromVersion);
                ResultSet rs = select.executeQuery()) {
            while (rs.next()) {
                result.add(readEvent(aggregateId, rs));
            }
        } catch (SQLException e) {
            throw EventStoreException.loadFailed(aggregateId, e);
        }
        return result;
    }

    private StoredEvent readEvent(String aggregateId, ResultSet rs) throws SQLException, EventStoreException {
        long sequence = schema.readSequenceNumber(rs);
        String type = schema.readEventType(rs);
        try {
            DomainEvent event = serialization.deserialize(schema.readPayloadVersion(rs), schema.readPayload(rs), type);
            EventMetadata metadata = serialization.deserializeMetadata(schema.readMetadata(rs));
            return new StoredEvent(aggregateId, sequence, type, event, metadata);
        } catch (UncheckedIOException | IllegalArgumentException e) {
            throw EventStoreException.serializationFailed(aggregateId, type, e);
        }
    }

    @Override
    public long currentVersion(String aggregateId) throws EventStoreException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = schema.selectAggregateVersion(connection, aggregateId);
                ResultSet rs = select.executeQuery()) {
            return rs.next() ? schema.readAggregateVersion(rs) : 0;
        } catch (SQLException e) {
            throw EventStoreException.loadFailed(aggregateId, e);
        }
    }

    static boolean isConstraintViolation(SQLException e) {
        for (SQLException ex = e; ex != null; ex = ex.getNextException()) {
            if (ex.getSQLState() != null && ex.getSQLState().startsWith("23")) {
                return true;
            }
        }
        return false;
    }

    private class AppendTemplate {
        private final String aggregateId;
        private final long expectedVersion;
        private final List<DomainEvent> events = new ArrayList<>();
        private final List<String> payloads = new ArrayList<>();
        private final List<String> metadata = new ArrayList<>();

        AppendTemplate(String aggregateId, long expectedVersion) {
            this.aggregateId = aggregateId;
            this.expectedVersion = expectedVersion;
        }

        void addEvent(DomainEvent event) throws EventStoreException {
            if (!aggregateId.equals(event.getAggregateId())) {
                throw EventStoreException.multipleAggregates(aggregateId, event);
            }
            if (!serialization.supports(event)) {
                throw EventStoreException.unsupported(event);
            }
            // serialize before touching the database, so that serialization errors do not need rollback
            try {
                payloads.add(serialization.serialize(event));
                metadata.add(serialization.serializeMetadata(event.getMetadata()));
            } catch (UncheckedIOException e) {
                throw EventStoreException.serializationFailed(aggregateId, event.getType(), e);
            }
            events.add(event);
        }

        Result<Long, ConcurrencyConflict> append() throws EventStoreException {
            if (events.isEmpty()) {
                throw EventStoreException.emptyAppend(aggregateId);
            }
            long newVersion = expectedVersion + events.size();
            try (Connection connection = dataSource.getConnection()) {
                connection.setAutoCommit(false);
                try {
                    if (!checkSourceVersion(connection)) {
                        connection.rollback();
                        return conflict();
                    }
                    storeEvents(connection);
                    if (!updateVersion(connection, newVersion)) {
                        connection.rollback();
                        return conflict();
                    }
                    connection.commit();
                    logger.debug("Appended {} events to {}, now at version {}", events.size(), aggregateId, newVersion);
                    return Result.success(newVersion);
                } catch (SQLException e) {
                    connection.rollback();
                    if (isConstraintViolation(e)) {
                        logger.debug("Concurrent append to {} detected by constraint violation", aggregateId, e);
                        return conflict();
                    }
                    throw e;
                } catch (RuntimeException e) {
                    connection.rollback();
                    throw e;
                }
            } catch (SQLException ex) {
                throw EventStoreException.storeFailed(aggregateId, ex);
            }
        }

        private Result<Long, ConcurrencyConflict> conflict() throws EventStoreException {
            long actual = currentVersion(aggregateId);
            logger.debug("Rejecting append to {}: expected version {}, actual {}", aggregateId, expectedVersion,
                actual);
            return Result.failure(new ConcurrencyConflict(aggregateId, expectedVersion, actual));
        }

        private boolean checkSourceVersion(Connection connection) throws SQLException {
            try (PreparedStatement selectVersion = schema.selectAggregateVersion(connection, aggregateId);
                    ResultSet rs = selectVersion.executeQuery()) {
                if (rs.next()) {
                    return schema.readAggregateVersion(rs) == expectedVersion;
                }
            }
            if (expectedVersion != 0) {
                return false;
            }
            // no aggregate version - create a new one. Concurrent creator fails on primary key.
            try (PreparedStatement createVersion = schema.createAggregateVersion(connection, aggregateId)) {
                createVersion.executeUpdate();
            }
            return true;
        }

        private void storeEvents(Connection connection) throws SQLException {
            try (PreparedStatement insertEvent = schema.insertEvent(connection)) {
                long sequence = expectedVersion;
                for (int i = 0; i < events.size(); i++) {
                    schema.prepareInsert(insertEvent, aggregateId, ++sequence, events.get(i), 1, payloads.get(i),
                        metadata.get(i));
                    insertEvent.addBatch();
                }
                insertEvent.executeBatch();
            }
        }

        private boolean updateVersion(Connection connection, long newVersion) throws SQLException {
            try (PreparedStatement updateVersion = schema.updateAggregateVersion(connection, aggregateId,
                expectedVersion, newVersion)) {
                return updateVersion.executeUpdate() == 1;
            }
        }
    }
}
