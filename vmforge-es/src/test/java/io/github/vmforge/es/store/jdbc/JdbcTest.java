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

import io.github.vmforge.es.TestEvent;
import io.github.vmforge.es.store.json.JacksonEventSerialization;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.rules.TestName;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.Assert.assertEquals;

public class JdbcTest {
    protected static JdbcDataSource ds;
    protected static JdbcTemplate template;
    @Rule
    public TestName testName = new TestName();
    protected DefaultJdbcSchema schema;
    protected JacksonEventSerialization serialization;
    protected JdbcEventStore eventStore;

    @BeforeClass
    public static void initDb() throws SQLException {
        ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:estest;DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        try (Connection con = ds.getConnection()) {
            executeSql(con, new DefaultJdbcSchema("event", "event_version").createTableStatements());
        }
        template = new JdbcTemplate(ds);
    }

    @AfterClass
    public static void dropDb() throws SQLException {
        try (Connection con = ds.getConnection()) {
            executeSql(con, "drop table event", "drop table event_version");
        }
    }

    static void executeSql(Connection con, String... statements) throws SQLException {
        for (String statement : statements) {
            try (CallableStatement cst = con.prepareCall(statement)) {
                cst.execute();
            }
        }
    }

    @Before
    public void setUp() {
        this.schema = new DefaultJdbcSchema("event", "event_version");
        this.serialization = new JacksonEventSerialization().register(TestEvent.class);
        this.eventStore = new JdbcEventStore(ds, schema, serialization);
    }

    protected String name() {
        return testName.getMethodName();
    }

    protected void assertDb(int expected, String sql, Object... params) {
        assertEquals(Integer.valueOf(expected), template.queryForObject(sql, Integer.class, params));
    }
}
