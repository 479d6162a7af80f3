package com.williamcallahan.kbingest.service;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a single remote attempt.
 *
 * <p>Remote boundaries convert provider exceptions into {@link Failure} so retry loops inspect a value
 * instead of unwinding the stack.</p>
 *
 * @param <T> payload type on success
 */
public sealed interface RemoteCallResult<T> permits RemoteCallResult.Success, RemoteCallResult.Failure {

    /**
     * Returns true when the attempt produced a payload.
     */
    boolean succeeded();

    /**
     * Returns the payload when present.
     */
    Optional<T> asOptional();

    /**
     * Chains a dependent remote step, short-circuiting on failure.
     */
    <R> RemoteCallResult<R> flatMap(Function<? super T, RemoteCallResult<R>> nextStep);

    static <T> RemoteCallResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> RemoteCallResult<T> failure(String reason) {
        return new Failure<>(reason, null);
    }

    static <T> RemoteCallResult<T> failure(String reason, Throwable cause) {
        return new Failure<>(reason, cause);
    }

    record Success<T>(T value) implements RemoteCallResult<T> {
        public Success {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean succeeded() {
            return true;
        }

        @Override
        public Optional<T> asOptional() {
            return Optional.of(value);
        }

        @Override
        public <R> RemoteCallResult<R> flatMap(Function<? super T, RemoteCallResult<R>> nextStep) {
            return Objects.requireNonNull(nextStep.apply(value), "nextStep result");
        }
    }

    /**
     * @param reason short diagnostic suitable for a log line
     * @param cause underlying exception, or null when the failure was detected without one
     */
    record Failure<T>(String reason, Throwable cause) implements RemoteCallResult<T> {
        public Failure {
            reason = reason == null || reason.isBlank() ? "unknown failure" : reason;
        }

        @Override
        public boolean succeeded() {
            return false;
        }

        @Override
        public Optional<T> asOptional() {
            return Optional.empty();
        }

        @Override
        public <R> RemoteCallResult<R> flatMap(Function<? super T, RemoteCallResult<R>> nextStep) {
            return new Failure<>(reason, cause);
        }
    }
}
