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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Scheduler that runs delayed tasks {@code factor} times sooner than requested and remembers the requested delays.
 * Immediate executions are not recorded.
 */
public class TimeCompressingScheduler extends ScheduledThreadPoolExecutor {
    private final long factor;
    private final List<Duration> requestedDelays = new CopyOnWriteArrayList<>();

    public TimeCompressingScheduler(int threads, long factor) {
        super(threads);
        this.factor = factor;
        setRemoveOnCancelPolicy(true);
    }

    public List<Duration> getRequestedDelays() {
        return new ArrayList<>(requestedDelays);
    }

    private long compress(long delay, TimeUnit unit) {
        if (delay > 0) {
            requestedDelays.add(Duration.ofNanos(unit.toNanos(delay)));
        }
        return unit.toNanos(delay) / factor;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
        return super.schedule(command, compress(delay, unit), TimeUnit.NANOSECONDS);
    }

    @Override
    public <V> ScheduledFuture<V> schedule(Callable<V> callable, long delay, TimeUnit unit) {
        return super.schedule(callable, compress(delay, unit), TimeUnit.NANOSECONDS);
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
        return super.scheduleAtFixedRate(command, compress(initialDelay, unit), Math.max(1, compress(period, unit)),
            TimeUnit.NANOSECONDS);
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay, long delay, TimeUnit unit) {
        return super.scheduleWithFixedDelay(command, compress(initialDelay, unit), Math.max(1, compress(delay, unit)),
            TimeUnit.NANOSECONDS);
    }
}
