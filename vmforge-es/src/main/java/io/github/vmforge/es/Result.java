package io.github.vmforge.es;

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

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of an operation that has expected failure modes. Either a success carrying a value, or a failure carrying
 * a typed error. Unexpected failures are still reported by exceptions.
 * <p>There are exactly two implementations, both private, so callers either use {@link #fold(Function, Function)}
 * or check {@link #isSuccess()} before reaching for the value.</p>
 *
 * @param <T> type of the success value
 * @param <E> type of the error
 */
public abstract class Result<T, E> {

    private Result() {
    }

    public static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    public static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(Objects.requireNonNull(error, "Failure must carry an error"));
    }

    public abstract boolean isSuccess();

    public final boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Value of a successful result.
     * @return the value
     * @throws IllegalStateException when this is a failure
     */
    public abstract T getValue();

    /**
     * Error of a failed result.
     * @return the error
     * @throws IllegalStateException when this is a success
     */
    public abstract E getError();

    public abstract <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure);

    public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        return fold(v -> Result.<U, E>success(mapper.apply(v)), Result::failure);
    }

    public <F> Result<T, F> mapError(Function<? super E, ? extends F> mapper) {
        return fold(Result::success, e -> Result.<T, F>failure(mapper.apply(e)));
    }

    public <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper) {
        return fold(mapper, Result::failure);
    }

    public Result<T, E> onSuccess(Consumer<? super T> consumer) {
        if (isSuccess()) {
            consumer.accept(getValue());
        }
        return this;
    }

    public Result<T, E> onFailure(Consumer<? super E> consumer) {
        if (isFailure()) {
            consumer.accept(getError());
        }
        return this;
    }

    private static final class Success<T, E> extends Result<T, E> {
        private final T value;

        Success(T value) {
            this.value = value;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public E getError() {
            throw new IllegalStateException("Successful result has no error");
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
            return onSuccess.apply(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Success && Objects.equals(value, ((Success<?, ?>) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return "Success{" + value + '}';
        }
    }

    private static final class Failure<T, E> extends Result<T, E> {
        private final E error;

        Failure(E error) {
            this.error = error;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getValue() {
            throw new IllegalStateException("Failed result has no value: " + error);
        }

        @Override
        public E getError() {
            return error;
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
            return onFailure.apply(error);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Failure && error.equals(((Failure<?, ?>) o).error);
        }

        @Override
        public int hashCode() {
            return error.hashCode();
        }

        @Override
        public String toString() {
            return "Failure{" + error + '}';
        }
    }
}
