package io.github.vmforge.es.matching;

/*-
 * #%L
 * vmforge-es
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
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Type based switch over events. Aggregates use it to fold events into state, listeners use it to route the events
 * they react to. Terminates on first match, in order of registration.
 *
 * @param <B> common base type of the matched objects
 */
public final class TypeSwitch<B> {

    private final List<Branch<? extends B>> branches;
    private final Consumer<? super B> fallback;

    private TypeSwitch(Builder<B> b) {
        this.branches = Collections.unmodifiableList(new ArrayList<>(b.branches));
        this.fallback = b.fallback;
    }

    /**
     * Execute first matching branch, or the fallback when no branch matches.
     * @param subject object to match
     * @return true if a branch (not the fallback) matched
     */
    public boolean apply(B subject) {
        for (Branch<? extends B> branch : branches) {
            if (branch.match(subject)) {
                return true;
            }
        }
        if (fallback != null) {
            fallback.accept(subject);
        }
        return false;
    }

    public static <B> Builder<B> builder(Class<B> baseType) {
        return new Builder<>();
    }

    public static final class Builder<B> {
        private final List<Branch<? extends B>> branches = new ArrayList<>();
        private Consumer<? super B> fallback;

        private Builder() {
        }

        public <T extends B> Builder<B> on(Class<T> type, Consumer<? super T> callback) {
            branches.add(new Branch<>(type, callback));
            return this;
        }

        public Builder<B> otherwise(Consumer<? super B> fallback) {
            this.fallback = fallback;
            return this;
        }

        public TypeSwitch<B> build() {
            return new TypeSwitch<>(this);
        }
    }

    private static final class Branch<T> {
        private final Class<T> type;
        private final Consumer<? super T> callback;

        Branch(Class<T> type, Consumer<? super T> callback) {
            this.type = Objects.requireNonNull(type, "Case class cannot be null");
            this.callback = Objects.requireNonNull(callback, "Callback cannot be null");
        }

        boolean match(Object subject) {
            if (subject != null && type.isInstance(subject)) {
                callback.accept(type.cast(subject));
                return true;
            }
            return false;
        }
    }
}
