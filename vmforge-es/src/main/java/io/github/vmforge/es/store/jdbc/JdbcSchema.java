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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * SQL dialect and table layout used by {@link JdbcEventStore}. Every method creating a statement binds its own
 * parameters, the store only executes them.
 */
public abstract class JdbcSchema {

    protected abstract PreparedStatement selectAggregateVersion(Connection connection, String aggregateId)
            throws SQLException;

    protected abstract long readAggregateVersion(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement createAggregateVersion(Connection connection, String aggregateId)
            throws SQLException;

    protected abstract PreparedStatement updateAggregateVersion(Connection connection, String aggregateId,
            long expectedVersion, long newVersion) throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, String aggregateId, long sequenceNumber,
            DomainEvent event, int payloadVersion, String payload, String metadata) throws SQLException;

    protected abstract PreparedStatement selectEvents(Connection connection, String aggregateId, long afterVersion)
            throws SQLException;

    protected abstract long readSequenceNumber(ResultSet rs) throws SQLException;

    protected abstract String readEventType(ResultSet rs) throws SQLException;

    protected abstract int readPayloadVersion(ResultSet rs) throws SQLException;

    protected abstract String readPayload(ResultSet rs) throws SQLException;

    protected abstract String readMetadata(ResultSet rs) throws SQLException;
}
