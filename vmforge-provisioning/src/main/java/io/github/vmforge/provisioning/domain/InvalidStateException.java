package io.github.vmforge.provisioning.domain;

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

/**
 * Transition guard violation: the operation is not allowed in current state of the aggregate.
 */
public class InvalidStateException extends DomainException {
    private final String aggregateId;
    private final String currentState;
    private final String operation;

    public InvalidStateException(String aggregateId, Object currentState, String operation) {
        super("Cannot " + operation + " " + aggregateId + " in state " + currentState);
        this.aggregateId = aggregateId;
        this.currentState = String.valueOf(currentState);
        this.operation = operation;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getOperation() {
        return operation;
    }
}
