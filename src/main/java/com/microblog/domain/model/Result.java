package com.microblog.domain.model;

/**
 * A sealed type representing the outcome of an operation that can either succeed or fail.
 * Expected business outcomes (not found, forbidden, conflict...) travel as {@link Failure}
 * values; exceptions are reserved for infrastructure faults.
 *
 * @param <T> the type of the success value
 * @param <E> the type of the error
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    record Success<T, E>(T value) implements Result<T, E> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public E errorOrNull() {
            return null;
        }
    }

    record Failure<T, E>(E error) implements Result<T, E> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            throw new IllegalStateException("Cannot get value from Failure: " + error);
        }

        @Override
        public E errorOrNull() {
            return error;
        }
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    T getOrThrow();

    E errorOrNull();

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    /**
     * Success without a payload, for commands that only report whether they were applied.
     */
    static <E> Result<Void, E> ok() {
        return new Success<>(null);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }
}
