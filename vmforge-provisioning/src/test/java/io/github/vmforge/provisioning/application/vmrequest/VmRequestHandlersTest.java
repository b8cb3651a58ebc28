package io.github.vmforge.provisioning.application.vmrequest;

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

import io.github.vmforge.es.DomainEvent;
import io.github.vmforge.es.EventMetadata;
import io.github.vmforge.es.Result;
import io.github.vmforge.es.store.ConcurrencyConflict;
import io.github.vmforge.es.store.EventStoreException;
import io.github.vmforge.es.store.StoredEvent;
import io.github.vmforge.es.store.inmemory.InMemoryEventStore;
import io.github.vmforge.provisioning.application.CommandError;
import io.github.vmforge.provisioning.application.CommandResult;
import io.github.vmforge.provisioning.application.port.TimelineEntry;
import io.github.vmforge.provisioning.application.port.TimelineEventType;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestApprovedEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestCancelledEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestRejectedEvent;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestStatus;
import io.github.vmforge.provisioning.domain.vmrequest.VmSize;
import io.github.vmforge.provisioning.testing.RecordingNotificationSender;
import io.github.vmforge.provisioning.testing.RecordingProjections;
import org.junit.Test;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class VmRequestHandlersTest {
    private static final String TENANT = "tenant-1";

    private final InMemoryEventStore store = new InMemoryEventStore();
    private final RecordingProjections projections = new RecordingProjections();
    private final RecordingNotificationSender notifications = new RecordingNotificationSender();

    private final CreateVmRequestHandler create = new CreateVmRequestHandler(store, projections, projections,
        notifications);
    private final ApproveVmRequestHandler approve = new ApproveVmRequestHandler(store, projections, projections,
        notifications);
    private final RejectVmRequestHandler reject = new RejectVmRequestHandler(store, projections, projections,
        notifications);
    private final CancelVmRequestHandler cancel = new CancelVmRequestHandler(store, projections, projections,
        notifications);

    private CreateVmRequestCommand.Builder createCommand() {
        CreateVmRequestCommand.Builder builder = new CreateVmRequestCommand.Builder();
        builder.tenantId(TENANT)
                .userId("alice")
                .userEmail("alice@example.com")
                .projectId("p-1")
                .projectName("Payments")
                .vmName("web-01")
                .size("M")
                .justification("Load testing of the checkout");
        return builder;
    }

    private String created() {
        Result<CommandResult, CommandError> result = create.handle(createCommand().build());
        assertTrue(result.toString(), result.isSuccess());
        return result.getValue().getAggregateId();
    }

    private ApproveVmRequestCommand approval(String tenantId, String requestId, String adminId) {
        return new ApproveVmRequestCommand.Builder().tenantId(tenantId).requestId(requestId).adminId(adminId).build();
    }

    @Test
    public void create_stores_request_and_updates_read_side() throws EventStoreException {
        Result<CommandResult, CommandError> result = create.handle(createCommand().size("l").build());
        String requestId = result.getValue().getAggregateId();

        assertEquals(1, result.getValue().getVersion());
        assertThat(store.load(requestId), hasSize(1));
        assertEquals(VmSize.L, projections.summary(requestId).get().getSize());
        assertEquals(VmRequestStatus.PENDING, projections.status(requestId));
        assertThat(projections.timelineOf(requestId), contains(TimelineEventType.CREATED));
        assertThat(notifications.getSent(), contains("created:" + requestId));
    }

    @Test
    public void invalid_input_stores_nothing() {
        Result<CommandResult, CommandError> result = create.handle(createCommand().vmName("Web_01").build());
        assertEquals(CommandError.Kind.VALIDATION, result.getError().getKind());
        result = create.handle(createCommand().size("XXL").build());
        assertEquals(CommandError.Kind.VALIDATION, result.getError().getKind());
        assertThat(notifications.getSent(), empty());
    }

    @Test
    public void failing_read_side_does_not_fail_command() throws EventStoreException {
        projections.fail();
        notifications.fail();
        Result<CommandResult, CommandError> result = create.handle(createCommand().build());
        assertTrue(result.isSuccess());
        assertThat(store.load(result.getValue().getAggregateId()), hasSize(1));
    }

    @Test
    public void approve_updates_status_timeline_and_notifies() throws EventStoreException {
        String requestId = created();
        Result<CommandResult, CommandError> result = approve.handle(approval(TENANT, requestId, "bob"));

        assertEquals(2, result.getValue().getVersion());
        List<StoredEvent> events = store.load(requestId);
        assertThat(events.get(1).getPayload(), instanceOf(VmRequestApprovedEvent.class));
        assertEquals("bob", events.get(1).getMetadata().getUserId());
        assertEquals(VmRequestStatus.APPROVED, projections.status(requestId));
        assertThat(projections.timelineOf(requestId),
            containsInAnyOrder(TimelineEventType.CREATED, TimelineEventType.APPROVED));
        assertThat(notifications.getSent(), contains("created:" + requestId, "approved:" + requestId));
    }

    @Test
    public void self_approval_is_forbidden() throws EventStoreException {
        String requestId = created();
        Result<CommandResult, CommandError> result = approve.handle(approval(TENANT, requestId, "alice"));
        assertEquals(CommandError.Kind.FORBIDDEN, result.getError().getKind());
        assertThat(store.load(requestId), hasSize(1));
    }

    @Test
    public void request_of_other_tenant_is_not_found() {
        String requestId = created();
        Result<CommandResult, CommandError> result = approve.handle(approval("tenant-2", requestId, "mallory"));
        assertEquals(CommandError.Kind.NOT_FOUND, result.getError().getKind());
        result = approve.handle(approval(TENANT, "no-such-request", "bob"));
        assertEquals(CommandError.Kind.NOT_FOUND, result.getError().getKind());
    }

    @Test
    public void concurrent_change_is_reported_as_conflict() {
        AtomicBoolean interfered = new AtomicBoolean();
        InMemoryEventStore racingStore = new InMemoryEventStore() {
            @Override
            public Result<Long, ConcurrencyConflict> append(String aggregateId, List<? extends DomainEvent> events,
                    long expectedVersion) throws EventStoreException {
                if (events.get(0) instanceof VmRequestApprovedEvent && interfered.compareAndSet(false, true)) {
                    super.append(aggregateId, Collections.singletonList(new VmRequestCancelledEvent.Builder()
                            .aggregateId(aggregateId)
                            .metadata(EventMetadata.create(TENANT, "alice"))
                            .build()), expectedVersion);
                }
                return super.append(aggregateId, events, expectedVersion);
            }
        };
        CreateVmRequestHandler racingCreate = new CreateVmRequestHandler(racingStore, projections, projections,
            notifications);
        ApproveVmRequestHandler racingApprove = new ApproveVmRequestHandler(racingStore, projections, projections,
            notifications);
        String requestId = racingCreate.handle(createCommand().build()).getValue().getAggregateId();

        Result<CommandResult, CommandError> result = racingApprove.handle(approval(TENANT, requestId, "bob"));
        CommandError error = result.getError();
        assertEquals(CommandError.Kind.CONCURRENCY_CONFLICT, error.getKind());
        assertEquals(1, error.getExpectedVersion());
        assertEquals(2, error.getActualVersion());
        assertEquals(VmRequestStatus.PENDING, projections.status(requestId));

        result = racingApprove.handle(approval(TENANT, requestId, "bob"));
        assertEquals(CommandError.Kind.INVALID_STATE, result.getError().getKind());
    }

    @Test
    public void reject_stores_trimmed_reason() throws EventStoreException {
        String requestId = created();
        Result<CommandResult, CommandError> result = reject.handle(new RejectVmRequestCommand.Builder()
                .tenantId(TENANT)
                .requestId(requestId)
                .adminId("bob")
                .reason("  Budget exhausted this quarter  ")
                .build());
        assertTrue(result.isSuccess());
        VmRequestRejectedEvent event = (VmRequestRejectedEvent) store.load(requestId).get(1).getPayload();
        assertEquals("Budget exhausted this quarter", event.getReason());
        assertEquals(VmRequestStatus.REJECTED, projections.status(requestId));
        TimelineEntry entry = projections.timelineEntries(requestId).stream()
                .filter(e -> e.getEventType() == TimelineEventType.REJECTED)
                .findFirst().get();
        assertEquals("Budget exhausted this quarter", entry.getDetails().get());
        assertThat(notifications.getSent(),
            contains("created:" + requestId, "rejected:" + requestId + ":Budget exhausted this quarter"));
    }

    @Test
    public void reject_with_short_reason_fails() throws EventStoreException {
        String requestId = created();
        Result<CommandResult, CommandError> result = reject.handle(new RejectVmRequestCommand.Builder()
                .tenantId(TENANT)
                .requestId(requestId)
                .adminId("bob")
                .reason("too short")
                .build());
        assertEquals(CommandError.Kind.INVALID_REASON, result.getError().getKind());
        assertThat(store.load(requestId), hasSize(1));
    }

    @Test
    public void repeated_cancel_succeeds_without_side_effects() throws EventStoreException {
        String requestId = created();
        CancelVmRequestCommand command = new CancelVmRequestCommand.Builder()
                .tenantId(TENANT)
                .requestId(requestId)
                .userId("alice")
                .reason("Not needed")
                .build();
        Result<CommandResult, CommandError> first = cancel.handle(command);
        Result<CommandResult, CommandError> second = cancel.handle(command);

        assertEquals(2, first.getValue().getVersion());
        assertEquals(2, second.getValue().getVersion());
        assertThat(store.load(requestId), hasSize(2));
        assertEquals(VmRequestStatus.CANCELLED, projections.status(requestId));
        assertThat(projections.timelineOf(requestId),
            containsInAnyOrder(TimelineEventType.CREATED, TimelineEventType.CANCELLED));
    }

    @Test
    public void cancel_by_other_user_is_forbidden() {
        String requestId = created();
        Result<CommandResult, CommandError> result = cancel.handle(new CancelVmRequestCommand.Builder()
                .tenantId(TENANT)
                .requestId(requestId)
                .userId("bob")
                .build());
        assertEquals(CommandError.Kind.FORBIDDEN, result.getError().getKind());
    }
}
