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
import java.sql.Timestamp;

/**
 * JDBC schema with one event table and one version table. Following tables are expected to exist:
 * <ul>
 * <li><em>eventTable</em>(AGGREGATE_ID, VERSION, TENANT_ID, EVENT_TYPE, PAYLOAD_VERSION, PAYLOAD, METADATA,
 * CREATED_AT) primary key (AGGREGATE_ID, VERSION)</li>
 * <li><em>versionTable</em>(AGGREGATE_ID, VERSION) primary key (AGGREGATE_ID)</li>
 * </ul>
 * {@link #createTableStatements()} produces matching DDL.
 */
public class DefaultJdbcSchema extends JdbcSchema {

    private final String eventTable;
    private final String versionTable;

    public DefaultJdbcSchema(String eventTable, String versionTable) {
        this.eventTable = eventTable;
        this.versionTable = versionTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getVersionTable() {
        return versionTable;
    }

    /**
     * Column type for JSON documents. H2 and Oracle understand clob, PostgreSQL subclasses would return text.
     * @return SQL type of payload columns
     */
    protected String getDocumentType() {
        return "clob";
    }

    public String[] createTableStatements() {
        return new String[] {
            "CREATE TABLE " + getEventTable() + " (AGGREGATE_ID varchar(64) NOT NULL, VERSION bigint NOT NULL, "
                    + "TENANT_ID varchar(64) NOT NULL, EVENT_TYPE varchar(128) NOT NULL, PAYLOAD_VERSION int NOT NULL, "
                    + "PAYLOAD " + getDocumentType() + " NOT NULL, METADATA " + getDocumentType() + " NOT NULL, "
                    + "CREATED_AT timestamp NOT NULL, PRIMARY KEY (AGGREGATE_ID, VERSION))",
            "CREATE TABLE " + getVersionTable() + " (AGGREGATE_ID varchar(64) NOT NULL PRIMARY KEY, "
                    + "VERSION bigint NOT NULL)"
        };
    }

    @Override
    protected PreparedStatement selectAggregateVersion(Connection connection, String aggregateId)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT VERSION FROM " + getVersionTable()
                + " WHERE AGGREGATE_ID=?");
        st.setString(1, aggregateId);
        return st;
    }

    @Override
    protected long readAggregateVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement createAggregateVersion(Connection connection, String aggregateId)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getVersionTable()
                + " (AGGREGATE_ID, VERSION) VALUES (?, 0)");
        st.setString(1, aggregateId);
        return st;
    }

    @Override
    protected PreparedStatement updateAggregateVersion(Connection connection, String aggregateId,
            long expectedVersion, long newVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getVersionTable()
                + " SET VERSION=? WHERE AGGREGATE_ID=? AND VERSION=?");
        st.setLong(1, newVersion);
        st.setString(2, aggregateId);
        st.setLong(3, expectedVersion);
        return st;
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (AGGREGATE_ID, VERSION, TENANT_ID, EVENT_TYPE, PAYLOAD_VERSION, PAYLOAD, METADATA, CREATED_AT)"
                + " VALUES (?,?,?,?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, String aggregateId, long sequenceNumber,
            DomainEvent event, int payloadVersion, String payload, String metadata) throws SQLException {
        insertEvent.setString(1, aggregateId);
        insertEvent.setLong(2, sequenceNumber);
        insertEvent.setString(3, event.getMetadata().getTenantId());
        insertEvent.setString(4, event.getType());
        insertEvent.setInt(5, payloadVersion);
        insertEvent.setString(6, payload);
        insertEvent.setString(7, metadata);
        insertEvent.setTimestamp(8, Timestamp.from(event.getMetadata().getTimestamp()));
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, String aggregateId, long afterVersion)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT VERSION, EVENT_TYPE, PAYLOAD_VERSION, PAYLOAD, "
                + "METADATA FROM " + getEventTable() + " WHERE AGGREGATE_ID=? AND VERSION > ? ORDER BY VERSION");
        st.setString(1, aggregateId);
        st.setLong(2, afterVersion);
        return st;
    }

    @Override
    protected long readSequenceNumber(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected String readEventType(ResultSet rs) throws SQLException {
        return rs.getString(2);
    }

    @Override
    protected int readPayloadVersion(ResultSet rs) throws SQLException {
        return rs.getInt(3);
    }

    @Override
    protected String readPayload(ResultSet rs) throws SQLException {
        return rs.getString(4);
    }

    @Override
    protected String readMetadata(ResultSet rs) throws SQLException {
        return rs.getString(5);
    }
}
