package io.github.vmforge.provisioning.infrastructure.hypervisor;

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

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Repeats a blocking probe until it yields a value or the number of polls fitting into the timeout is used up.
 * Probes run on the I/O executor, waits between them on the scheduler. Completing or cancelling the returned future
 * stops polling.
 *
 * <p>The limit counts polls, not wall time: at most {@code timeout / interval} probes are made, so polling ends
 * within the timeout plus the time the probes themselves took.</p>
 *
 * @param <T> type of polled value
 */
final class Poller<T> implements Runnable {

    /**
     * Blocking check.
     * @param <T> value type
     */
    @FunctionalInterface
    interface Probe<T> {
        /**
         * @return the value, or empty to poll again
         * @throws HypervisorBindingException to stop polling with failure
         */
        Optional<T> probe() throws HypervisorBindingException;
    }

    private final ScheduledExecutorService scheduler;
    private final Executor io;
    private final Duration interval;
    private final long maxPolls;
    private final Probe<T> probe;
    private final CompletableFuture<Optional<T>> promise = new CompletableFuture<>();
    private volatile ScheduledFuture<?> next;
    private long polls;

    private Poller(ScheduledExecutorService scheduler, Executor io, Duration interval, Duration timeout,
            Probe<T> probe) {
        this.scheduler = scheduler;
        this.io = io;
        this.interval = interval;
        this.maxPolls = Math.max(1, timeout.toMillis() / Math.max(1, interval.toMillis()));
        this.probe = probe;
    }

    /**
     * Start polling immediately.
     * @return value of the probe, or empty after timeout
     */
    static <T> CompletableFuture<Optional<T>> poll(ScheduledExecutorService scheduler, Executor io,
            Duration interval, Duration timeout, Probe<T> probe) {
        Poller<T> poller = new Poller<>(scheduler, io, interval, timeout, probe);
        poller.promise.whenComplete((v, t) -> {
            ScheduledFuture<?> pending = poller.next;
            if (pending != null) {
                pending.cancel(false);
            }
        });
        poller.submit();
        return poller.promise;
    }

    @Override
    public void run() {
        submit();
    }

    private void submit() {
        if (promise.isDone()) {
            return;
        }
        try {
            io.execute(this::probeOnce);
        } catch (RejectedExecutionException e) {
            promise.completeExceptionally(e);
        }
    }

    private void probeOnce() {
        if (promise.isDone()) {
            return;
        }
        try {
            Optional<T> value = probe.probe();
            polls++;
            if (value.isPresent()) {
                promise.complete(value);
            } else if (polls >= maxPolls) {
                promise.complete(Optional.empty());
            } else {
                next = scheduler.schedule(this, interval.toMillis(), TimeUnit.MILLISECONDS);
                if (promise.isDone()) {
                    next.cancel(false);
                }
            }
        } catch (HypervisorBindingException | RuntimeException e) {
            promise.completeExceptionally(e);
        }
    }
}
