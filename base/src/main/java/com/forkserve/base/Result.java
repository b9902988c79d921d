package com.forkserve.base;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a call that is allowed to fail.
 *
 * The runtime uses it where a failure is routine: request bodies that are not
 * JSON, sockets that are already gone when closed, workers that exited first.
 *
 * <pre>{@code
 * Object body = codec.decode(bytes).getOrElse(Map.of());
 *
 * Result.run(channel::close)
 *       .onFailure(e -> debug("close failed: {}", e.getMessage()));
 * }</pre>
 *
 * @param <A> value carried on success
 */
public sealed interface Result<A> permits Result.Success, Result.Failure {

    static <A> Result<A> success(A value) {
        return new Success<>(value);
    }

    static <A> Result<A> failure(Throwable cause) {
        return new Failure<>(cause);
    }

    /**
     * Evaluate {@code supplier}; anything it throws, or a {@code null} value,
     * becomes a failure.
     */
    static <A> Result<A> of(Attempt<A> supplier) {
        try {
            return success(supplier.get());
        } catch (Throwable t) {
            return failure(t);
        }
    }

    /**
     * Cleanup variant of {@link #of}: the caller only cares whether it threw.
     */
    static Result<Boolean> run(Action action) {
        return of(() -> {
            action.run();
            return Boolean.TRUE;
        });
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    default Optional<Throwable> error() {
        return this instanceof Failure<A> f ? Optional.of(f.cause()) : Optional.empty();
    }

    default A getOrElse(A fallback) {
        return this instanceof Success<A> s ? s.value() : fallback;
    }

    /**
     * The value, or the failure rethrown. Checked causes are wrapped.
     */
    default A getOrThrow() {
        if (this instanceof Success<A> s) {
            return s.value();
        }
        Throwable cause = ((Failure<A>) this).cause();
        if (cause instanceof RuntimeException re) {
            throw re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        throw new IllegalStateException(cause);
    }

    default <B> Result<B> map(Function<A, B> f) {
        return flatMap(a -> success(f.apply(a)));
    }

    @SuppressWarnings("unchecked")
    default <B> Result<B> flatMap(Function<A, Result<B>> f) {
        if (this instanceof Success<A> s) {
            try {
                return f.apply(s.value());
            } catch (Throwable t) {
                return failure(t);
            }
        }
        return (Result<B>) this;
    }

    default Result<A> onSuccess(Consumer<A> action) {
        if (this instanceof Success<A> s) {
            action.accept(s.value());
        }
        return this;
    }

    default Result<A> onFailure(Consumer<Throwable> action) {
        if (this instanceof Failure<A> f) {
            action.accept(f.cause());
        }
        return this;
    }

    record Success<A>(A value) implements Result<A> {
        public Success {
            Objects.requireNonNull(value, "value");
        }
    }

    record Failure<A>(Throwable cause) implements Result<A> {
        public Failure {
            Objects.requireNonNull(cause, "cause");
        }
    }

    @FunctionalInterface
    interface Attempt<A> {
        A get() throws Throwable;
    }

    @FunctionalInterface
    interface Action {
        void run() throws Throwable;
    }
}
