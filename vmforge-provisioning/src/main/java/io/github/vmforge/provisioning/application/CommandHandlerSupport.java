package io.github.vmforge.provisioning.application;

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
import io.github.vmforge.es.Result;
import io.github.vmforge.es.store.ConcurrencyConflict;
import io.github.vmforge.es.store.EventStore;
import io.github.vmforge.es.store.EventStoreException;
import io.github.vmforge.es.store.StoredEvent;
import io.github.vmforge.provisioning.domain.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * Common flow of command handlers: load, reconstitute, execute, append, side effects.
 *
 * <p>Subclasses express the command in terms of {@link #load(String, BiFunction)}, {@link #commit(AggregateRoot)}
 * and {@link #bestEffort(String, Runnable)}. Storage failures and domain rejections become {@link CommandError}s,
 * nothing is retried automatically. Side effects run only after the events were durably appended and their failures
 * are logged without affecting the outcome of the command.</p>
 */
public abstract class CommandHandlerSupport {
    /**
     * Actor of events produced by reactions of the system rather than by users.
     */
    public static final String SYSTEM_ACTOR = "system";

    protected final Logger logger = LoggerFactory.getLogger(getClass());
    protected final EventStore eventStore;

    protected CommandHandlerSupport(EventStore eventStore) {
        this.eventStore = Objects.requireNonNull(eventStore, "Event store is required");
    }

    /**
     * Load and reconstitute an aggregate.
     * @param aggregateId id of the aggregate
     * @param factory reconstitutes aggregate out of its id and history
     * @param <A> type of aggregate
     * @return the aggregate, or {@link CommandError.Kind#NOT_FOUND} for empty stream
     */
    protected <A extends AggregateRoot> Result<A, CommandError> load(String aggregateId,
            BiFunction<String, List<DomainEvent>, A> factory) {
        List<StoredEvent> history;
        try {
            history = eventStore.load(aggregateId);
        } catch (EventStoreException e) {
            logger.error("Loading aggregate {} failed", aggregateId, e);
            return Result.failure(CommandError.persistenceFailure(e.getMessage()));
        }
        if (history.isEmpty()) {
            return Result.failure(CommandError.notFound(aggregateId));
        }
        List<DomainEvent> events = history.stream().map(StoredEvent::getPayload).collect(Collectors.toList());
        return Result.success(factory.apply(aggregateId, events));
    }

    /**
     * Append uncommitted events of the aggregate with its expected version and mark them committed on success.
     * @param aggregate aggregate with uncommitted events
     * @return new version, or conflict or persistence failure
     */
    protected Result<Long, CommandError> commit(AggregateRoot aggregate) {
        if (!aggregate.hasUncommittedEvents()) {
            return Result.success(aggregate.getVersion());
        }
        Result<Long, ConcurrencyConflict> appended;
        try {
            appended = eventStore.append(aggregate.getId(), aggregate.getUncommittedEvents(),
                aggregate.getExpectedVersion());
        } catch (EventStoreException e) {
            logger.error("Appending to aggregate {} failed", aggregate.getId(), e);
            return Result.failure(CommandError.persistenceFailure(e.getMessage()));
        }
        if (appended.isFailure()) {
            ConcurrencyConflict conflict = appended.getError();
            logger.info("Concurrent modification of {}, expected version {} but was {}", conflict.getAggregateId(),
                conflict.getExpectedVersion(), conflict.getActualVersion());
            return Result.failure(CommandError.concurrencyConflict(conflict));
        }
        aggregate.markCommitted();
        logger.info("Aggregate {} reached version {}", aggregate.getId(), appended.getValue());
        return Result.success(appended.getValue());
    }

    /**
     * Execute a domain operation on aggregate and commit it.
     * @param aggregate the aggregate
     * @param operation command method invocation
     * @return new version, or the error
     */
    protected Result<Long, CommandError> execute(AggregateRoot aggregate, DomainOperation operation) {
        try {
            operation.run();
        } catch (DomainException e) {
            logger.info("Command on {} rejected: {}", aggregate.getId(), e.getMessage());
            return Result.failure(CommandError.of(e));
        }
        return commit(aggregate);
    }

    /**
     * Run side effect that must not influence outcome of the command.
     * @param description what the side effect does, for the log
     * @param sideEffect the action
     */
    protected void bestEffort(String description, Runnable sideEffect) {
        try {
            sideEffect.run();
        } catch (RuntimeException e) {
            logger.warn("Failed to {}, continuing", description, e);
        }
    }

    /**
     * Invocation of an aggregate command method.
     */
    @FunctionalInterface
    protected interface DomainOperation {
        void run() throws DomainException;
    }
}
