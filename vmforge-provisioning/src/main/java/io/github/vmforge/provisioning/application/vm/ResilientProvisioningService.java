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
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.vmforge.es.Result;
import io.github.vmforge.provisioning.application.hypervisor.HypervisorError;
import io.github.vmforge.provisioning.application.hypervisor.HypervisorPort;
import io.github.vmforge.provisioning.application.hypervisor.ProgressListener;
import io.github.vmforge.provisioning.application.hypervisor.ProvisioningResult;
import io.github.vmforge.provisioning.application.hypervisor.ProvisioningSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Creates VMs through the {@link HypervisorPort}, retrying transient failures with exponential backoff and guarding
 * the hypervisor by a circuit breaker.
 *
 * <p>The circuit breaker wraps the whole retry sequence. Only sequences that exhausted their attempts count as
 * failed calls; a permanent error means the hypervisor did answer, so it is recorded as success. While the breaker is
 * open, calls fail immediately with {@link ProvisioningFailure.Kind#UNAVAILABLE}.</p>
 *
 * <p>Each attempt is limited by {@link RetrySettings#getAttemptTimeout()}, timing out is a retriable failure.
 * Backoff waits and timeouts run on the scheduler, no thread waits for them. Cancelling the returned future stops the
 * running attempt, prevents further ones and gives back the circuit breaker permission.</p>
 */
public class ResilientProvisioningService {
    private static final Logger logger = LoggerFactory.getLogger(ResilientProvisioningService.class);

    private final HypervisorPort hypervisor;
    private final ScheduledExecutorService scheduler;
    private final RetryConfig retryConfig;
    private final TimeLimiter timeLimiter;
    private final CircuitBreaker circuitBreaker;

    public ResilientProvisioningService(HypervisorPort hypervisor, ScheduledExecutorService scheduler,
            RetrySettings retrySettings, CircuitBreakerSettings circuitBreakerSettings) {
        this.hypervisor = Objects.requireNonNull(hypervisor, "Hypervisor port is required");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler is required");
        this.retryConfig = RetryConfig.<Result<ProvisioningResult, HypervisorError>>custom()
                .maxAttempts(retrySettings.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(retrySettings.getInitialBackoff().toMillis(),
                    retrySettings.getMultiplier(), retrySettings.getMaxBackoff().toMillis()))
                .retryOnResult(result -> result.isFailure() && result.getError().isRetriable())
                .retryOnException(t -> false)
                .build();
        this.timeLimiter = TimeLimiter.of("provisioning-attempt", TimeLimiterConfig.custom()
                .timeoutDuration(retrySettings.getAttemptTimeout())
                .cancelRunningFuture(true)
                .build());
        this.circuitBreaker = CircuitBreaker.of("hypervisor", CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(circuitBreakerSettings.getSlidingWindowSize())
                .minimumNumberOfCalls(circuitBreakerSettings.getMinimumCalls())
                .failureRateThreshold(circuitBreakerSettings.getFailureRateThreshold())
                .waitDurationInOpenState(circuitBreakerSettings.getOpenDuration())
                .permittedNumberOfCallsInHalfOpenState(circuitBreakerSettings.getHalfOpenCalls())
                .build());
        this.circuitBreaker.getEventPublisher()
                .onStateTransition(e -> logger.warn("Hypervisor circuit breaker {}", e.getStateTransition()));
    }

    public ResilientProvisioningService(HypervisorPort hypervisor, ScheduledExecutorService scheduler) {
        this(hypervisor, scheduler, RetrySettings.DEFAULT, CircuitBreakerSettings.DEFAULT);
    }

    /**
     * Create a VM, retrying as configured.
     * @param spec what to create
     * @param correlationId correlation of the provisioning, for logs
     * @param onProgress receives stages of every attempt, stages of failed attempts included
     * @return created VM or reason of giving up. The future does not complete exceptionally except when cancelled
     */
    public CompletableFuture<Result<ProvisioningResult, ProvisioningFailure>> createVmWithRetry(ProvisioningSpec spec,
            String correlationId, ProgressListener onProgress) {
        if (!circuitBreaker.tryAcquirePermission()) {
            logger.warn("Provisioning {} of {} rejected, circuit breaker is {}", correlationId, spec.getName(),
                circuitBreaker.getState());
            return CompletableFuture.completedFuture(Result.failure(ProvisioningFailure.unavailable()));
        }
        return new Sequence(spec, correlationId, onProgress).start();
    }

    public CircuitBreaker.State getCircuitBreakerState() {
        return circuitBreaker.getState();
    }

    /**
     * One retry sequence holding one circuit breaker permission.
     */
    private class Sequence {
        private final ProvisioningSpec spec;
        private final String correlationId;
        private final ProgressListener onProgress;
        private final CompletableFuture<Result<ProvisioningResult, ProvisioningFailure>> outcome =
                new CompletableFuture<>();
        private final AtomicInteger attempts = new AtomicInteger();
        private final AtomicBoolean permissionSettled = new AtomicBoolean();
        private final AtomicReference<CompletableFuture<?>> currentAttempt = new AtomicReference<>();
        private final long start = circuitBreaker.getCurrentTimestamp();

        Sequence(ProvisioningSpec spec, String correlationId, ProgressListener onProgress) {
            this.spec = spec;
            this.correlationId = correlationId;
            this.onProgress = onProgress;
        }

        CompletableFuture<Result<ProvisioningResult, ProvisioningFailure>> start() {
            outcome.whenComplete((result, t) -> {
                if (t instanceof CancellationException) {
                    cancelled();
                }
            });
            Retry retry = Retry.of("provisioning-" + correlationId, retryConfig);
            retry.getEventPublisher().onRetry(e -> logger.warn("Provisioning {} attempt {} failed, retrying in {} ms",
                correlationId, e.getNumberOfRetryAttempts(), e.getWaitInterval().toMillis()));
            retry.executeCompletionStage(scheduler, this::attempt)
                    .whenComplete((result, t) -> {
                        if (t != null) {
                            failed(t);
                        } else {
                            completed(result);
                        }
                    });
            return outcome;
        }

        private CompletionStage<Result<ProvisioningResult, HypervisorError>> attempt() {
            if (outcome.isDone()) {
                CompletableFuture<Result<ProvisioningResult, HypervisorError>> aborted = new CompletableFuture<>();
                aborted.completeExceptionally(new CancellationException("Provisioning " + correlationId
                        + " was cancelled"));
                return aborted;
            }
            int attempt = attempts.incrementAndGet();
            logger.info("Provisioning {} of {}, attempt {}", correlationId, spec.getName(), attempt);
            return timeLimiter.executeCompletionStage(scheduler, this::invokeHypervisor)
                    .handle(this::attemptOutcome);
        }

        private CompletableFuture<Result<ProvisioningResult, HypervisorError>> invokeHypervisor() {
            CompletableFuture<Result<ProvisioningResult, HypervisorError>> call;
            try {
                call = hypervisor.createVm(spec, onProgress);
            } catch (RuntimeException e) {
                call = new CompletableFuture<>();
                call.completeExceptionally(e);
            }
            currentAttempt.set(call);
            if (outcome.isDone()) {
                call.cancel(true);
            }
            return call;
        }

        private Result<ProvisioningResult, HypervisorError> attemptOutcome(
                Result<ProvisioningResult, HypervisorError> result, Throwable t) {
            if (t == null) {
                if (result.isFailure()) {
                    logger.info("Provisioning {} attempt {} failed: {}", correlationId, attempts.get(),
                        result.getError());
                }
                return result;
            }
            Throwable cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
            if (cause instanceof TimeoutException) {
                return Result.failure(HypervisorError.timeout("Attempt " + attempts.get() + " did not finish in time"));
            }
            if (cause instanceof CancellationException || outcome.isDone()) {
                throw new CompletionException(cause);
            }
            logger.warn("Provisioning {} attempt {} failed unexpectedly", correlationId, attempts.get(), cause);
            return Result.failure(HypervisorError.api("Unexpected failure: " + cause.getMessage()));
        }

        private void completed(Result<ProvisioningResult, HypervisorError> result) {
            if (result.isSuccess()) {
                recordSuccess();
                logger.info("Provisioning {} of {} succeeded after {} attempt(s)", correlationId, spec.getName(),
                    attempts.get());
                outcome.complete(Result.success(result.getValue()));
                return;
            }
            HypervisorError error = result.getError();
            if (error.isRetriable()) {
                ProvisioningFailure failure = ProvisioningFailure.exhausted(attempts.get(), error);
                recordFailure(failure);
                logger.error("Provisioning {} of {} gave up after {} attempts: {}", correlationId, spec.getName(),
                    attempts.get(), error);
                outcome.complete(Result.failure(failure));
            } else {
                recordSuccess();
                logger.warn("Provisioning {} of {} failed permanently: {}", correlationId, spec.getName(), error);
                outcome.complete(Result.failure(ProvisioningFailure.permanent(attempts.get(), error)));
            }
        }

        private void failed(Throwable t) {
            Throwable cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
            if (cause instanceof CancellationException || outcome.isDone()) {
                cancelled();
                return;
            }
            if (permissionSettled.compareAndSet(false, true)) {
                circuitBreaker.onError(elapsed(), circuitBreaker.getTimestampUnit(), cause);
            }
            logger.error("Provisioning {} of {} failed unexpectedly", correlationId, spec.getName(), cause);
            outcome.completeExceptionally(cause);
        }

        private void cancelled() {
            CompletableFuture<?> running = currentAttempt.get();
            if (running != null) {
                running.cancel(true);
            }
            if (permissionSettled.compareAndSet(false, true)) {
                circuitBreaker.releasePermission();
                logger.info("Provisioning {} of {} cancelled after {} attempt(s)", correlationId, spec.getName(),
                    attempts.get());
            }
        }

        private void recordSuccess() {
            if (permissionSettled.compareAndSet(false, true)) {
                circuitBreaker.onSuccess(elapsed(), circuitBreaker.getTimestampUnit());
            }
        }

        private void recordFailure(ProvisioningFailure failure) {
            if (permissionSettled.compareAndSet(false, true)) {
                circuitBreaker.onError(elapsed(), circuitBreaker.getTimestampUnit(),
                    new ProvisioningExhaustedException(failure));
            }
        }

        private long elapsed() {
            return circuitBreaker.getCurrentTimestamp() - start;
        }
    }

    /**
     * Recorded by the circuit breaker as cause of failed call.
     */
    static class ProvisioningExhaustedException extends RuntimeException {
        ProvisioningExhaustedException(ProvisioningFailure failure) {
            super(failure.getMessage(), null, false, false);
        }
    }
}
