package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.error.ParseError;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of running a parser - either success with a value and resume position or failure.
 *
 * <p>A failure carries no resume position: whoever ran the parser continues from the
 * position it started at.
 *
 * <p>Both variants may also carry the furthest failure that was recovered from on the way,
 * for example the failure that ended a repetition. It only feeds error reporting and takes
 * no part in equality.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Furthest failure recovered from while producing this result, or {@code null}.
     */
    ParseError furthest();

    /**
     * The deepest failure known to this result: the recorded furthest failure, or for a
     * failure its own error when that lies at least as far.
     */
    Optional<ParseError> deepestFailure();

    /**
     * This result with {@code failure} recorded as recovered from, if it lies further than the
     * failure recorded so far.
     */
    ParseResult<T> absorb(ParseError failure);

    /**
     * Transform the value of a success; failures pass through unchanged.
     */
    <R> ParseResult<R> map(Function<? super T, ? extends R> mapper);

    /**
     * Collapse either variant into a single value.
     */
    <R> R fold(Function<? super ParseError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    /**
     * The value as {@link Optional}. Empty for failures and for successes carrying {@code null}.
     */
    Optional<T> toOptional();

    /**
     * The value of a success.
     *
     * @throws IllegalStateException if this is a failure
     */
    T unwrap();

    static <T> ParseResult<T> success(T value, int next) {
        return new Success<>(value, next);
    }

    static <T> ParseResult<T> failure(ParseError error) {
        return new Failure<>(error);
    }

    /**
     * View a result of a subtype as a result of its supertype. Results are immutable, so this is safe.
     */
    @SuppressWarnings("unchecked")
    static <T> ParseResult<T> widen(ParseResult<? extends T> result) {
        return (ParseResult<T>) result;
    }

    /**
     * Successful parse with produced value and position to resume from.
     */
    record Success<T>(T value, int next, ParseError furthest) implements ParseResult<T> {

        public Success {
            if (next < 0) {
                throw new IllegalArgumentException("Negative resume position " + next);
            }
        }

        public Success(T value, int next) {
            this(value, next, null);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<ParseError> deepestFailure() {
            return Optional.ofNullable(furthest);
        }

        @Override
        public Success<T> absorb(ParseError failure) {
            var deeper = ParseError.deeper(furthest, failure);
            return deeper == furthest ? this : new Success<>(value, next, deeper);
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value), next, furthest);
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure,
                          Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.ofNullable(value);
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Success<?> other
                && next == other.next
                && Objects.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, next);
        }
    }

    /**
     * Failed parse - no match at the position the parser was started at.
     */
    record Failure<T>(ParseError error, ParseError furthest) implements ParseResult<T> {

        public Failure {
            Objects.requireNonNull(error, "error");
        }

        public Failure(ParseError error) {
            this(error, null);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<ParseError> deepestFailure() {
            return Optional.of(ParseError.deeper(error, furthest));
        }

        @Override
        public Failure<T> absorb(ParseError failure) {
            var deeper = ParseError.deeper(furthest, failure);
            return deeper == furthest ? this : new Failure<>(error, deeper);
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return retype();
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure,
                          Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(error);
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.empty();
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException(error.message());
        }

        /**
         * The same failure as the outcome of a parser with a different output type.
         */
        public <R> Failure<R> retype() {
            return new Failure<>(error, furthest);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Failure<?> other && error.equals(other.error);
        }

        @Override
        public int hashCode() {
            return error.hashCode();
        }
    }
}
