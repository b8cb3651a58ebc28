package io.github.vmforge.provisioning.testing;

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

import io.github.vmforge.provisioning.application.port.ProjectionUpdater;
import io.github.vmforge.provisioning.application.port.ProvisioningProgress;
import io.github.vmforge.provisioning.application.port.ProvisioningProgressRepository;
import io.github.vmforge.provisioning.application.port.TimelineEntry;
import io.github.vmforge.provisioning.application.port.TimelineEventType;
import io.github.vmforge.provisioning.application.port.TimelineUpdater;
import io.github.vmforge.provisioning.application.port.VmRequestSummary;
import io.github.vmforge.provisioning.domain.vm.ProvisioningStage;
import io.github.vmforge.provisioning.domain.vmrequest.VmRequestStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Read side stub: request summaries, timeline and provisioning progress kept in maps.
 */
public class RecordingProjections implements ProjectionUpdater, TimelineUpdater, ProvisioningProgressRepository {
    private final Map<String, VmRequestSummary> summaries = new ConcurrentHashMap<>();
    private final Map<String, VmRequestStatus> statuses = new ConcurrentHashMap<>();
    private final Map<UUID, TimelineEntry> timeline = new ConcurrentHashMap<>();
    private final Map<String, ProvisioningProgress> progress = new ConcurrentHashMap<>();
    private final List<ProvisioningStage> savedStages = new CopyOnWriteArrayList<>();
    private final List<String> deletedProgress = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    /**
     * Make every further update throw.
     */
    public void fail() {
        failing = true;
    }

    private void check() {
        if (failing) {
            throw new IllegalStateException("Read database unavailable");
        }
    }

    @Override
    public void insert(VmRequestSummary summary) {
        check();
        summaries.put(summary.getRequestId(), summary);
        statuses.put(summary.getRequestId(), summary.getStatus());
    }

    @Override
    public void updateStatus(String tenantId, String requestId, VmRequestStatus status, long version) {
        check();
        statuses.put(requestId, status);
    }

    @Override
    public void addTimelineEvent(TimelineEntry entry) {
        check();
        timeline.putIfAbsent(entry.getId(), entry);
    }

    @Override
    public void save(ProvisioningProgress progress) {
        check();
        savedStages.add(progress.getStage());
        this.progress.put(progress.getVmId(), progress);
    }

    @Override
    public void delete(String tenantId, String vmId) {
        check();
        deletedProgress.add(vmId);
        progress.remove(vmId);
    }

    @Override
    public Optional<ProvisioningProgress> find(String tenantId, String vmId) {
        return Optional.ofNullable(progress.get(vmId)).filter(p -> p.getTenantId().equals(tenantId));
    }

    public Optional<VmRequestSummary> summary(String requestId) {
        return Optional.ofNullable(summaries.get(requestId));
    }

    public VmRequestStatus status(String requestId) {
        return statuses.get(requestId);
    }

    public List<TimelineEventType> timelineOf(String requestId) {
        return timeline.values().stream()
                .filter(e -> e.getRequestId().equals(requestId))
                .map(TimelineEntry::getEventType)
                .collect(Collectors.toList());
    }

    public List<TimelineEntry> timelineEntries(String requestId) {
        return timeline.values().stream()
                .filter(e -> e.getRequestId().equals(requestId))
                .collect(Collectors.toList());
    }

    public List<ProvisioningStage> getSavedStages() {
        return new ArrayList<>(savedStages);
    }

    public List<String> getDeletedProgress() {
        return new ArrayList<>(deletedProgress);
    }
}
