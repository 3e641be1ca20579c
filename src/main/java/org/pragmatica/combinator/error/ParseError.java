package org.pragmatica.combinator.error;

import org.pragmatica.combinator.tree.SourceLocation;

import java.util.Objects;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError {

    SourceLocation location();

    /**
     * Description of the construct that was expected at {@link #location()}.
     */
    String expected();

    String message();

    /**
     * The failure that triggered this one. Only sequence failures wrap another error.
     */
    default ParseError root() {
        return this;
    }

    /**
     * The failure that lies further into the input. Either may be {@code null}; on a tie
     * {@code current} is kept.
     */
    static ParseError deeper(ParseError current, ParseError candidate) {
        if (candidate == null) {
            return current;
        }
        if (current == null || candidate.location().offset() > current.location().offset()) {
            return candidate;
        }
        return current;
    }

    /**
     * Predicate attempted past the end of input.
     */
    record EndOfInput(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * Predicate evaluated to false at a valid position.
     */
    record Unsatisfied(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    /**
     * A component of a sequence failed after the components before it matched.
     * Located where the failing component failed, not where the sequence started.
     */
    record SequenceFailure(ParseError cause) implements ParseError {

        public SequenceFailure {
            Objects.requireNonNull(cause, "cause");
        }

        /**
         * Wrap a component failure, keeping chains one level deep.
         */
        public static ParseError of(ParseError cause) {
            return cause instanceof SequenceFailure ? cause : new SequenceFailure(cause);
        }

        @Override
        public SourceLocation location() {
            return cause.location();
        }

        @Override
        public String expected() {
            return cause.expected();
        }

        @Override
        public ParseError root() {
            return cause.root();
        }

        @Override
        public String message() {
            return cause.message();
        }
    }

    /**
     * A repetition tried to collect more values than the configured limit allows.
     */
    record AllocationFailure(
    SourceLocation location,
    int limit) implements ParseError {
        @Override
        public String expected() {
            return "at most " + limit + " repetitions";
        }

        @Override
        public String message() {
            return "Repetition limit of " + limit + " exceeded at " + location;
        }
    }

    /**
     * Digits that do not fit the target numeric type.
     */
    record NumericOverflow(
    SourceLocation location,
    String digits,
    long limit) implements ParseError {
        @Override
        public String expected() {
            return "number not greater than " + limit;
        }

        @Override
        public String message() {
            return "Number " + digits + " at " + location + " exceeds " + limit;
        }
    }
}
