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

import io.github.vmforge.es.store.ConcurrencyConflict;
import io.github.vmforge.provisioning.domain.DomainException;
import io.github.vmforge.provisioning.domain.ForbiddenException;
import io.github.vmforge.provisioning.domain.InvalidReasonException;
import io.github.vmforge.provisioning.domain.InvalidStateException;
import io.github.vmforge.provisioning.domain.InvalidValueException;

import java.util.Objects;

/**
 * Reason a command was not executed. Versions are only meaningful for {@link Kind#CONCURRENCY_CONFLICT}.
 */
public final class CommandError {

    public enum Kind {
        VALIDATION, NOT_FOUND, FORBIDDEN, INVALID_STATE, INVALID_REASON, CONCURRENCY_CONFLICT, PERSISTENCE_FAILURE
    }

    private final Kind kind;
    private final String message;
    private final long expectedVersion;
    private final long actualVersion;

    private CommandError(Kind kind, String message, long expectedVersion, long actualVersion) {
        this.kind = Objects.requireNonNull(kind, "Kind is required");
        this.message = message;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    private CommandError(Kind kind, String message) {
        this(kind, message, -1, -1);
    }

    public static CommandError validation(String message) {
        return new CommandError(Kind.VALIDATION, message);
    }

    public static CommandError notFound(String aggregateId) {
        return new CommandError(Kind.NOT_FOUND, "Aggregate " + aggregateId + " not found");
    }

    public static CommandError concurrencyConflict(ConcurrencyConflict conflict) {
        return new CommandError(Kind.CONCURRENCY_CONFLICT, "Aggregate " + conflict.getAggregateId()
                + " was modified concurrently", conflict.getExpectedVersion(), conflict.getActualVersion());
    }

    public static CommandError persistenceFailure(String message) {
        return new CommandError(Kind.PERSISTENCE_FAILURE, message);
    }

    /**
     * Translate rejection of domain rules.
     * @param e the rejection
     * @return error of matching kind
     */
    public static CommandError of(DomainException e) {
        if (e instanceof ForbiddenException) {
            return new CommandError(Kind.FORBIDDEN, e.getMessage());
        } else if (e instanceof InvalidStateException) {
            return new CommandError(Kind.INVALID_STATE, e.getMessage());
        } else if (e instanceof InvalidReasonException) {
            return new CommandError(Kind.INVALID_REASON, e.getMessage());
        } else if (e instanceof InvalidValueException) {
            return new CommandError(Kind.VALIDATION, e.getMessage());
        }
        throw new IllegalArgumentException("Unknown domain exception", e);
    }

    public Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CommandError)) {
            return false;
        }
        CommandError that = (CommandError) o;
        return kind == that.kind && expectedVersion == that.expectedVersion && actualVersion == that.actualVersion
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, expectedVersion, actualVersion);
    }

    @Override
    public String toString() {
        if (kind == Kind.CONCURRENCY_CONFLICT) {
            return "CommandError{" + kind + " expected " + expectedVersion + " actual " + actualVersion + '}';
        }
        return "CommandError{" + kind + ": " + message + '}';
    }
}
