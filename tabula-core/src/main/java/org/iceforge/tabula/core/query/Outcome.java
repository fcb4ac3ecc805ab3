package org.iceforge.tabula.core.query;

import java.util.Objects;
import java.util.function.Function;

/**
 * Success-or-classified-error result passed between the validator, builder and executor.
 * <p>
 * Steps compose with {@link #flatMap(Function)}; the first failure short-circuits the rest.
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure {

    static <T> Outcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> failure(ErrorKind kind, String message) {
        return new Failure<>(new QueryError(kind, message));
    }

    static <T> Outcome<T> failure(QueryError error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    <R> Outcome<R> map(Function<? super T, ? extends R> fn);

    <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> fn);

    record Success<T>(T value) implements Outcome<T> {
        public Success {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> Outcome<R> map(Function<? super T, ? extends R> fn) {
            return new Success<>(fn.apply(value));
        }

        @Override
        public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> fn) {
            return Objects.requireNonNull(fn.apply(value), "flatMap result");
        }
    }

    record Failure<T>(QueryError error) implements Outcome<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <R> Outcome<R> map(Function<? super T, ? extends R> fn) {
            return new Failure<>(error);
        }

        @Override
        public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> fn) {
            return new Failure<>(error);
        }
    }
}
