package io.github.vmforge.provisioning.application.vm;

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

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.vmforge.es.Result;
import io.github.vmforge.provisioning.application.hypervisor.HypervisorError;
import io.github.vmforge.provisioning.application.hypervisor.ProvisioningErrorCode;
import io.github.vmforge.provisioning.application.hypervisor.ProvisioningResult;
import io.github.vmforge.provisioning.application.hypervisor.ProvisioningSpec;
import io.github.vmforge.provisioning.domain.vm.ProvisioningStage;
import io.github.vmforge.provisioning.testing.ScriptedHypervisor;
import io.github.vmforge.provisioning.testing.TimeCompressingScheduler;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ResilientProvisioningServiceTest {
    private static final Duration DEFAULT_TIMEOUT = RetrySettings.DEFAULT.getAttemptTimeout();

    @Rule
    public TestName testName = new TestName();

    private final TimeCompressingScheduler scheduler = new TimeCompressingScheduler(2, 1000);
    private final ScriptedHypervisor hypervisor = new ScriptedHypervisor();
    private final List<ProvisioningStage> stages = new CopyOnWriteArrayList<>();

    @After
    public void stopScheduler() {
        scheduler.shutdownNow();
    }

    private ProvisioningSpec spec() {
        return new ProvisioningSpec.Builder()
                .tenantId("tenant-1")
                .name("payments-" + testName.getMethodName().replace('_', '-'))
                .template("ubuntu-22.04")
                .cpuCores(2)
                .memoryMb(4096)
                .datacenterName("dc1")
                .clusterName("cluster1")
                .datastoreName("ds1")
                .networkName("vm-network")
                .build();
    }

    private Result<ProvisioningResult, ProvisioningFailure> provision(ResilientProvisioningService service)
            throws Exception {
        return service.createVmWithRetry(spec(), testName.getMethodName(), stages::add).get(10, TimeUnit.SECONDS);
    }

    private List<Duration> backoffDelays() {
        return scheduler.getRequestedDelays().stream()
                .filter(d -> !d.equals(DEFAULT_TIMEOUT))
                .collect(Collectors.toList());
    }

    @Test
    public void transient_failures_are_retried_with_exponential_backoff() throws Exception {
        hypervisor.thenFail(HypervisorError.connection("Connection refused"));
        ResilientProvisioningService service = new ResilientProvisioningService(hypervisor, scheduler);

        Result<ProvisioningResult, ProvisioningFailure> result = provision(service);

        assertTrue(result.isFailure());
        ProvisioningFailure failure = result.getError();
        assertEquals(ProvisioningFailure.Kind.EXHAUSTED, failure.getKind());
        assertEquals(5, failure.getAttemptCount());
        assertEquals(ProvisioningErrorCode.CONNECTION_FAILED, failure.getErrorCode());
        assertEquals(5, hypervisor.getCallCount());
        assertThat(backoffDelays(), contains(Duration.ofSeconds(10), Duration.ofSeconds(20), Duration.ofSeconds(40),
            Duration.ofSeconds(80)));
        assertThat(stages, hasSize(5));
        assertThat(stages, everyItem(is(ProvisioningStage.CLONING)));
    }

    @Test
    public void success_after_retries_returns_created_vm() throws Exception {
        ProvisioningResult vm = ScriptedHypervisor.vm("vm-7", "payments-web", "10.0.0.7");
        hypervisor.thenFail(HypervisorError.resourceExhausted("No capacity"))
                .thenFail(HypervisorError.timeout("Slow"))
                .thenSucceed(vm);
        ResilientProvisioningService service = new ResilientProvisioningService(hypervisor, scheduler);

        Result<ProvisioningResult, ProvisioningFailure> result = provision(service);

        assertEquals(vm, result.getValue());
        assertEquals(3, hypervisor.getCallCount());
        assertThat(backoffDelays(), contains(Duration.ofSeconds(10), Duration.ofSeconds(20)));
        assertEquals(ProvisioningStage.READY, stages.get(stages.size() - 1));
    }

    @Test
    public void permanent_error_is_not_retried_and_keeps_breaker_closed() throws Exception {
        hypervisor.thenFail(HypervisorError.provisioning("Template is corrupt", ProvisioningErrorCode.VM_CONFIG_INVALID));
        ResilientProvisioningService service = new ResilientProvisioningService(hypervisor, scheduler);

        for (int i = 0; i < 6; i++) {
            Result<ProvisioningResult, ProvisioningFailure> result = provision(service);
            assertEquals(ProvisioningFailure.Kind.PERMANENT, result.getError().getKind());
            assertEquals(1, result.getError().getAttemptCount());
            assertEquals(ProvisioningErrorCode.VM_CONFIG_INVALID, result.getError().getErrorCode());
        }
        assertEquals(6, hypervisor.getCallCount());
        assertThat(backoffDelays(), empty());
        assertEquals(CircuitBreaker.State.CLOSED, service.getCircuitBreakerState());
    }

    @Test
    public void attempt_exceeding_timeout_fails_as_retriable_timeout() throws Exception {
        hypervisor.thenHang();
        ResilientProvisioningService service = new ResilientProvisioningService(hypervisor, scheduler,
            new RetrySettings(2, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(1), Duration.ofSeconds(30)),
            CircuitBreakerSettings.DEFAULT);

        Result<ProvisioningResult, ProvisioningFailure> result = provision(service);

        ProvisioningFailure failure = result.getError();
        assertEquals(ProvisioningFailure.Kind.EXHAUSTED, failure.getKind());
        assertEquals(2, failure.getAttemptCount());
        assertEquals(HypervisorError.Kind.TIMEOUT, failure.getError().getKind());
        assertEquals(ProvisioningErrorCode.CONNECTION_TIMEOUT, failure.getErrorCode());
        for (CompletableFuture<?> call : hypervisor.getCalls()) {
            assertTrue(call.isDone());
        }
    }

    @Test
    public void open_breaker_rejects_without_calling_hypervisor() throws Exception {
        hypervisor.thenFail(HypervisorError.connection("Connection refused"));
        ResilientProvisioningService service = new ResilientProvisioningService(hypervisor, scheduler,
            new RetrySettings(1, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(1), Duration.ofSeconds(30)),
            new CircuitBreakerSettings(2, 2, 100f, Duration.ofMinutes(5), 1));

        assertEquals(ProvisioningFailure.Kind.EXHAUSTED, provision(service).getError().getKind());
        assertEquals(ProvisioningFailure.Kind.EXHAUSTED, provision(service).getError().getKind());
        assertEquals(CircuitBreaker.State.OPEN, service.getCircuitBreakerState());

        Result<ProvisioningResult, ProvisioningFailure> rejected = provision(service);
        assertEquals(ProvisioningFailure.Kind.UNAVAILABLE, rejected.getError().getKind());
        assertEquals(ProvisioningErrorCode.CONNECTION_FAILED, rejected.getError().getErrorCode());
        assertEquals(2, hypervisor.getCallCount());
    }

    @Test
    public void cancelled_sequence_gives_back_breaker_permission() throws Exception {
        hypervisor.thenFail(HypervisorError.connection("Connection refused"))
                .thenHang()
                .thenSucceed(ScriptedHypervisor.vm("vm-1", "payments-web", "10.0.0.1"));
        // real time scheduler, the breaker measures open duration by wall clock
        scheduler.shutdownNow();
        TimeCompressingScheduler realTime = new TimeCompressingScheduler(2, 1);
        try {
            ResilientProvisioningService service = new ResilientProvisioningService(hypervisor, realTime,
                new RetrySettings(1, Duration.ofMillis(10), 2.0, Duration.ofMillis(10), Duration.ofSeconds(30)),
                new CircuitBreakerSettings(1, 1, 100f, Duration.ofMillis(200), 1));
            assertEquals(ProvisioningFailure.Kind.EXHAUSTED, service.createVmWithRetry(spec(), "first",
                stages::add).get(5, TimeUnit.SECONDS).getError().getKind());
            assertEquals(CircuitBreaker.State.OPEN, service.getCircuitBreakerState());

            Thread.sleep(400);
            CompletableFuture<Result<ProvisioningResult, ProvisioningFailure>> hanging =
                    service.createVmWithRetry(spec(), "probe", stages::add);
            assertEquals(CircuitBreaker.State.HALF_OPEN, service.getCircuitBreakerState());
            assertEquals(2, hypervisor.getCallCount());
            hanging.cancel(true);

            Result<ProvisioningResult, ProvisioningFailure> result = service.createVmWithRetry(spec(), "second probe",
                stages::add).get(5, TimeUnit.SECONDS);
            assertTrue(result.isSuccess());
            assertEquals(3, hypervisor.getCallCount());
            assertTrue(hypervisor.getCalls().get(1).isCancelled());
            assertEquals(CircuitBreaker.State.CLOSED, service.getCircuitBreakerState());
        } finally {
            realTime.shutdownNow();
        }
    }
}
