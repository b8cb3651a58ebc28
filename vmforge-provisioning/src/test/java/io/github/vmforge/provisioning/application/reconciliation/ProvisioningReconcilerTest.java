package io.github.vmforge.provisioning.application.reconciliation;

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

import io.github.vmforge.es.EventMetadata;
import io.github.vmforge.es.store.StoredEvent;
import io.github.vmforge.es.store.inmemory.InMemoryEventStore;
import io.github.vmforge.provisioning.domain.vm.VmAggregate;
import io.github.vmforge.provisioning.domain.vmrequest.VmSize;
import org.junit.After;
import org.junit.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class ProvisioningReconcilerTest {
    private final InMemoryEventStore store = new InMemoryEventStore();
    private final ReconciliationQueue queue = new ReconciliationQueue();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @After
    public void stopScheduler() {
        scheduler.shutdownNow();
    }

    @Test
    public void failing_entry_is_retried_until_attempts_run_out() {
        ProvisioningReconciler reconciler = new ProvisioningReconciler(store, queue, scheduler, 2);
        queue.enqueue("vm-missing", "request-missing", "tenant-1");

        assertEquals(0, reconciler.runOnce());
        assertEquals(1, queue.size());
        assertEquals(0, reconciler.runOnce());
        assertEquals(0, queue.size());
    }

    @Test
    public void vm_that_is_not_ready_is_not_copied() throws Exception {
        VmAggregate vm = VmAggregate.startProvisioning("request-1", "p-1", "Payments", "web-01", VmSize.S, "alice",
            "alice@example.com", EventMetadata.create("tenant-1", "system"));
        store.append(vm.getId(), vm.getUncommittedEvents(), 0);
        ProvisioningReconciler reconciler = new ProvisioningReconciler(store, queue, scheduler, 3);
        queue.enqueue(vm.getId(), "request-1", "tenant-1");

        assertEquals(0, reconciler.runOnce());
        assertEquals(0, queue.size());
    }

    @Test
    public void entries_survive_unexpected_failure() {
        InMemoryEventStore brokenStore = new InMemoryEventStore() {
            @Override
            public List<StoredEvent> loadFrom(String aggregateId, long fromVersion) {
                if (aggregateId.equals("vm-broken")) {
                    throw new IllegalStateException("Driver bug");
                }
                return super.loadFrom(aggregateId, fromVersion);
            }
        };
        ProvisioningReconciler reconciler = new ProvisioningReconciler(brokenStore, queue, scheduler, 1);
        queue.enqueue("vm-missing", "request-1", "tenant-1");
        queue.enqueue("vm-broken", "request-2", "tenant-1");
        queue.enqueue("vm-other", "request-3", "tenant-1");

        try {
            reconciler.runOnce();
            fail("Unexpected failure should propagate");
        } catch (IllegalStateException e) {
            assertEquals("Driver bug", e.getMessage());
        }
        List<String> remaining = queue.drain().stream().map(ReconciliationQueue.Entry::getVmId)
                .collect(Collectors.toList());
        assertEquals(Arrays.asList("vm-broken", "vm-other"), remaining);
    }

    @Test
    public void periodic_run_drains_queue() throws Exception {
        ProvisioningReconciler reconciler = new ProvisioningReconciler(store, queue, scheduler, 1);
        queue.enqueue("vm-missing", "request-missing", "tenant-1");
        reconciler.start(Duration.ofMillis(20));
        try {
            long deadline = System.currentTimeMillis() + 5000;
            while (queue.size() > 0) {
                if (System.currentTimeMillis() > deadline) {
                    fail("Queue was not drained");
                }
                Thread.sleep(10);
            }
        } finally {
            reconciler.stop();
        }
    }

    @Test(expected = IllegalStateException.class)
    public void reconciliation_cannot_be_started_twice() {
        ProvisioningReconciler reconciler = new ProvisioningReconciler(store, queue, scheduler, 1);
        reconciler.start(Duration.ofMinutes(1));
        reconciler.start(Duration.ofMinutes(1));
    }
}
