package io.github.vmforge.provisioning.infrastructure.eventstore;

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

import io.github.vmforge.es.AggregateRoot;
import io.github.vmforge.es.DomainEvent;
import io.github.vmforge.es.EventMetadata;
import io.github.vmforge.es.store.EventStoreException;
import io.github.vmforge.es.store.StoredEvent;
import io.github.vmforge.es.store.jdbc.DefaultJdbcSchema;
import io.github.vmforge.es.store.jdbc.JdbcEventStore;
import io.github.vmforge.provisioning.domain.vm.ProvisioningStage;
import io.github.vmforge.provisioning.domain.vm.VmAggregate;
import io.github.vmforge.provisioning.domain.vmrequest.VmName;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestAggregate;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestRejectedEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestStatus;
import io.github.vmforge.provisioning.domain.vmrequest.VmSize;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ProvisioningEventSerializationTest {
    private static JdbcDataSource ds;

    private JdbcEventStore eventStore;

    @BeforeClass
    public static void initDb() throws SQLException {
        ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:provisioning;DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        try (Connection con = ds.getConnection()) {
            executeSql(con, new DefaultJdbcSchema("event", "event_version").createTableStatements());
        }
    }

    @AfterClass
    public static void dropDb() throws SQLException {
        try (Connection con = ds.getConnection()) {
            executeSql(con, "drop table event", "drop table event_version");
        }
    }

    private static void executeSql(Connection con, String... statements) throws SQLException {
        for (String statement : statements) {
            try (CallableStatement cst = con.prepareCall(statement)) {
                cst.execute();
            }
        }
    }

    @Before
    public void setUp() {
        eventStore = new JdbcEventStore(ds, new DefaultJdbcSchema("event", "event_version"),
                ProvisioningEventSerialization.create());
    }

    @Test
    public void request_lifecycle_survives_persistence() throws Exception {
        EventMetadata createdBy = EventMetadata.create("tenant-1", "alice", "corr-1");
        VmRequestAggregate request = VmRequestAggregate.create("alice@example.com", "project-1", "Payments",
                VmName.of("web-01"), VmSize.L, "Needed for the payment gateway", createdBy);
        request.approve("admin", createdBy.followUp("admin"));
        request.markProvisioning(VmAggregate.idForRequest(request.getId()), createdBy.followUp("system"));
        request.markReady("vm-42", "10.0.0.7", "PAYM-web-01", null, createdBy.followUp("system"));
        persist(request);

        List<StoredEvent> stored = eventStore.load(request.getId());
        assertEquals(4, stored.size());
        assertEquals("corr-1", stored.get(3).getMetadata().getCorrelationId());
        assertEquals("admin", stored.get(1).getMetadata().getUserId());

        VmRequestAggregate loaded = VmRequestAggregate.reconstitute(request.getId(), payloads(stored));
        assertEquals(VmRequestStatus.READY, loaded.getStatus());
        assertEquals(4, loaded.getVersion());
        assertEquals("tenant-1", loaded.getTenantId());
        assertEquals(VmSize.L, loaded.getSize());
        assertEquals("web-01", loaded.getVmName());
        assertEquals("Needed for the payment gateway", loaded.getJustification());
        assertEquals("vm-42", loaded.getHypervisorVmId());
        assertEquals("10.0.0.7", loaded.getIpAddress());
        assertEquals("PAYM-web-01", loaded.getHostname());
    }

    @Test
    public void rejection_reason_survives_persistence() throws Exception {
        EventMetadata createdBy = EventMetadata.create("tenant-1", "bob");
        VmRequestAggregate request = VmRequestAggregate.create("bob@example.com", "project-1", "Payments",
                VmName.of("db-01"), VmSize.S, "Database for integration tests", createdBy);
        request.reject("admin", "Use the shared database", createdBy.followUp("admin"));
        persist(request);

        List<DomainEvent> events = payloads(eventStore.load(request.getId()));
        assertEquals(VmRequestStatus.REJECTED, VmRequestAggregate.reconstitute(request.getId(), events).getStatus());
        VmRequestRejectedEvent rejected = (VmRequestRejectedEvent) events.get(1);
        assertEquals("Use the shared database", rejected.getReason());
        assertEquals("admin", rejected.getMetadata().getUserId());
    }

    @Test
    public void failed_vm_survives_persistence() throws Exception {
        EventMetadata metadata = EventMetadata.create("tenant-2", "system");
        VmAggregate vm = VmAggregate.startProvisioning("request-7", "project-2", "Billing", "app-01", VmSize.M,
                "carol", "carol@example.com", metadata);
        vm.updateProgress(ProvisioningStage.CLONING, metadata);
        vm.markFailed("Connection refused", "CONNECTION_FAILED", 3, metadata);
        persist(vm);

        VmAggregate loaded = VmAggregate.reconstitute(vm.getId(), payloads(eventStore.load(vm.getId())));
        assertEquals(ProvisioningStage.FAILED, loaded.getStage());
        assertEquals("request-7", loaded.getRequestId());
        assertEquals(VmSize.M, loaded.getSize());
        assertEquals("CONNECTION_FAILED", loaded.getErrorCode());
        assertEquals("Connection refused", loaded.getFailureReason());
    }

    @Test
    public void provisioned_vm_without_ip_keeps_warning() throws Exception {
        EventMetadata metadata = EventMetadata.create("tenant-2", "system");
        VmAggregate vm = VmAggregate.startProvisioning("request-8", "project-2", "Billing", "app-02", VmSize.S,
                "carol", "carol@example.com", metadata);
        vm.markProvisioned("vm-8", null, "BILL-app-02", "IP address not detected", metadata);
        persist(vm);

        VmAggregate loaded = VmAggregate.reconstitute(vm.getId(), payloads(eventStore.load(vm.getId())));
        assertEquals(ProvisioningStage.READY, loaded.getStage());
        assertEquals("vm-8", loaded.getHypervisorVmId());
        assertEquals("IP address not detected", loaded.getWarning());
    }

    private void persist(AggregateRoot aggregate) throws EventStoreException {
        assertTrue(eventStore.append(aggregate.getId(), aggregate.getUncommittedEvents(),
                aggregate.getExpectedVersion()).isSuccess());
    }

    private static List<DomainEvent> payloads(List<StoredEvent> stored) {
        return stored.stream().map(StoredEvent::getPayload).collect(Collectors.toList());
    }
}
