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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Requests whose status could not be brought in line with their VM. Entries are added by the provisioning saga and
 * consumed by the {@link ProvisioningReconciler}.
 */
public class ReconciliationQueue {
    private final ConcurrentLinkedQueue<Entry> entries = new ConcurrentLinkedQueue<>();

    public void enqueue(String vmId, String requestId, String tenantId) {
        enqueue(new Entry(vmId, requestId, tenantId, 0));
    }

    void enqueue(Entry entry) {
        entries.add(entry);
    }

    /**
     * Take all entries queued so far. Entries added meanwhile stay for the next drain.
     * @return queued entries, oldest first
     */
    List<Entry> drain() {
        List<Entry> result = new ArrayList<>();
        for (int i = entries.size(); i > 0; i--) {
            Entry entry = entries.poll();
            if (entry == null) {
                break;
            }
            result.add(entry);
        }
        return result;
    }

    public int size() {
        return entries.size();
    }

    public static final class Entry {
        private final String vmId;
        private final String requestId;
        private final String tenantId;
        private final int attempts;

        Entry(String vmId, String requestId, String tenantId, int attempts) {
            this.vmId = Objects.requireNonNull(vmId, "VM id is required");
            this.requestId = Objects.requireNonNull(requestId, "Request id is required");
            this.tenantId = Objects.requireNonNull(tenantId, "Tenant id is required");
            this.attempts = attempts;
        }

        public String getVmId() {
            return vmId;
        }

        public String getRequestId() {
            return requestId;
        }

        public String getTenantId() {
            return tenantId;
        }

        /**
         * @return number of failed repair attempts
         */
        public int getAttempts() {
            return attempts;
        }

        Entry retried() {
            return new Entry(vmId, requestId, tenantId, attempts + 1);
        }

        @Override
        public String toString() {
            return "Entry{vm=" + vmId + ", request=" + requestId + ", tenant=" + tenantId + ", attempts=" + attempts
                    + '}';
        }
    }
}
