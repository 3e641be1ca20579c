package org.pragmatica.combinator;

import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.parser.Pair;
import org.pragmatica.combinator.parser.ParseResult;
import org.pragmatica.combinator.parser.Parser;
import org.pragmatica.combinator.parser.ParserConfig;
import org.pragmatica.combinator.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Entry point for building parsers by composition.
 *
 * <p>Example usage:
 * <pre>{@code
 * var label = Parsers.letter().manyOne();
 * var className = Parsers.rightOnly(Parsers.symbol('.'), label);
 * var node = label.and(className.optional());
 *
 * var result = node.parse("div.root");
 * }</pre>
 *
 * <p>Every parser built here is immutable and keeps no state between calls.
 * A failure never carries a resume position, so a caller that sees a failure
 * continues from the position it started at.
 */
public final class Parsers {

    private static final Logger LOGGER = LoggerFactory.getLogger(Parsers.class);

    private Parsers() {}

    // === Atomic Matchers ===

    /**
     * Match exactly one symbol satisfying {@code predicate}.
     *
     * <p>Fails with {@link ParseError.EndOfInput} at the end of input and with
     * {@link ParseError.Unsatisfied} when the predicate does not hold. Never advances on failure.
     *
     * @param expected description of the accepted symbols, used in error reports
     */
    public static Parser<Character> satisfy(Predicate<Character> predicate, String expected) {
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(expected, "expected");

        return (input, position) -> {
            if (input.isAtEnd(position)) {
                return ParseResult.failure(new ParseError.EndOfInput(input.location(position), expected));
            }
            var symbol = input.symbolAt(position);
            if (!predicate.test(symbol)) {
                return ParseResult.failure(new ParseError.Unsatisfied(input.location(position),
                                                                      String.valueOf(symbol),
                                                                      expected));
            }
            return ParseResult.success(symbol, position + 1);
        };
    }

    public static Parser<Character> symbol(char expected) {
        return satisfy(c -> c == expected, "'" + expected + "'");
    }

    /**
     * ASCII letter: [a-zA-Z]
     */
    public static Parser<Character> letter() {
        return satisfy(c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'), "letter");
    }

    /**
     * ASCII digit: [0-9]
     */
    public static Parser<Character> digit() {
        return satisfy(c -> c >= '0' && c <= '9', "digit");
    }

    /**
     * Space or tab.
     */
    public static Parser<Character> space() {
        return satisfy(c -> c == ' ' || c == '\t', "space");
    }

    /**
     * Succeed without consuming anything, only at the end of input.
     */
    public static Parser<Void> endOfInput() {
        return (input, position) -> input.isAtEnd(position)
            ? ParseResult.success(null, position)
            : ParseResult.failure(new ParseError.Unsatisfied(input.location(position),
                                                              String.valueOf(input.symbolAt(position)),
                                                              "end of input"));
    }

    // === Sequencing ===

    /**
     * Run {@code first}, then {@code second} where {@code first} stopped; keep both outputs.
     */
    public static <A, B> Parser<Pair<A, B>> and(Parser<A> first, Parser<B> second) {
        return sequence(first, second, Pair::of);
    }

    /**
     * Run {@code first}, then {@code second} where {@code first} stopped; keep the output of {@code second}.
     *
     * <p>If {@code second} fails the whole sequence fails. What {@code first} consumed is not
     * undone here; backtracking belongs to {@link #orElse(Parser, Parser)}.
     */
    public static <A, B> Parser<B> andThen(Parser<A> first, Parser<B> second) {
        return sequence(first, second, (left, right) -> right);
    }

    /**
     * Marker-then-payload form, e.g. a leading {@code '.'} followed by a class name.
     * The marker output is discarded.
     */
    public static <A, B> Parser<B> rightOnly(Parser<A> marker, Parser<B> payload) {
        return andThen(marker, payload);
    }

    /**
     * Run {@code first}, then {@code trailer}; keep the output of {@code first}.
     */
    public static <A, B> Parser<A> leftOnly(Parser<A> first, Parser<B> trailer) {
        return sequence(first, trailer, (left, right) -> left);
    }

    private static <A, B, R> Parser<R> sequence(Parser<A> first,
                                                 Parser<B> second,
                                                 BiFunction<? super A, ? super B, ? extends R> combiner) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");

        return (input, position) -> {
            var head = first.parse(input, position);
            if (head instanceof ParseResult.Failure<A> failure) {
                return failure.retype();
            }
            var left = (ParseResult.Success<A>) head;

            var tail = second.parse(input, left.next());
            if (tail instanceof ParseResult.Failure<B> failure) {
                return new ParseResult.Failure<R>(ParseError.SequenceFailure.of(failure.error()), failure.furthest())
                    .absorb(left.furthest());
            }
            var right = (ParseResult.Success<B>) tail;

            return new ParseResult.Success<R>(combiner.apply(left.value(), right.value()),
                                              right.next(),
                                              right.furthest())
                .absorb(left.furthest());
        };
    }

    // === Alternatives ===

    /**
     * Ordered choice: {@code first}, and if it fails, {@code second} from the same position.
     *
     * <p>{@code second} never sees anything {@code first} consumed before failing. When both
     * would succeed, {@code first} wins. When both fail, the failure of {@code second} is reported
     * and the failure of {@code first} is only kept as a recovered failure.
     */
    public static <T> Parser<T> orElse(Parser<? extends T> first, Parser<? extends T> second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");

        return (input, position) -> {
            var result = first.parse(input, position);
            if (result.isSuccess()) {
                return ParseResult.widen(result);
            }
            return ParseResult.<T>widen(second.parse(input, position))
                              .absorb(deepest(result));
        };
    }

    /**
     * Ordered choice over any number of alternatives. Reports the failure of the last one.
     */
    @SafeVarargs
    public static <T> Parser<T> choice(Parser<? extends T>... alternatives) {
        if (alternatives.length == 0) {
            throw new IllegalArgumentException("Choice needs at least one alternative");
        }
        var options = List.of(alternatives);

        return (input, position) -> {
            ParseResult<T> result = null;
            ParseError recovered = null;
            for (var alternative : options) {
                result = ParseResult.<T>widen(alternative.parse(input, position)).absorb(recovered);
                if (result.isSuccess()) {
                    break;
                }
                recovered = deepest(result);
            }
            return result;
        };
    }

    // === Repetition ===

    /**
     * Zero or more applications of {@code parser}. Never fails because of {@code parser}.
     */
    public static <T> Parser<List<T>> many(Parser<T> parser) {
        return many(parser, ParserConfig.DEFAULT);
    }

    public static <T> Parser<List<T>> many(Parser<T> parser, ParserConfig config) {
        return repeat(parser, 0, Integer.MAX_VALUE, config);
    }

    /**
     * One or more applications of {@code parser}; fails if the first one fails.
     */
    public static <T> Parser<List<T>> manyOne(Parser<T> parser) {
        return manyOne(parser, ParserConfig.DEFAULT);
    }

    public static <T> Parser<List<T>> manyOne(Parser<T> parser, ParserConfig config) {
        return repeat(parser, 1, Integer.MAX_VALUE, config);
    }

    /**
     * Between {@code min} and {@code max} applications of {@code parser}.
     */
    public static <T> Parser<List<T>> times(Parser<T> parser, int min, int max) {
        return times(parser, min, max, ParserConfig.DEFAULT);
    }

    public static <T> Parser<List<T>> times(Parser<T> parser, int min, int max, ParserConfig config) {
        if (min < 0) {
            throw new IllegalArgumentException("Min is negative: " + min);
        }
        if (max < min) {
            throw new IllegalArgumentException("Max " + max + " is less than min " + min);
        }
        return repeat(parser, min, max, config);
    }

    /**
     * Shared repetition loop.
     *
     * <p>The collection is created per call. A success that consumes nothing is recorded, and
     * once the minimum is reached it ends the loop, since repeating it would never advance.
     * Collecting more than {@link ParserConfig#maxRepetitions()} values fails the repetition
     * with {@link ParseError.AllocationFailure} instead of dropping values.
     */
    private static <T> Parser<List<T>> repeat(Parser<T> parser, int min, int max, ParserConfig config) {
        Objects.requireNonNull(parser, "parser");
        Objects.requireNonNull(config, "config");

        return (input, position) -> {
            var values = new ArrayList<T>();
            var current = position;
            ParseError recovered = null;

            while (values.size() < max) {
                var result = parser.parse(input, current);
                if (result instanceof ParseResult.Failure<T> failure) {
                    if (values.size() < min) {
                        return failure.<List<T>>retype().absorb(recovered);
                    }
                    recovered = ParseError.deeper(recovered, deepest(failure));
                    break;
                }
                var success = (ParseResult.Success<T>) result;

                if (values.size() >= config.maxRepetitions()) {
                    LOGGER.debug("Repetition limit {} reached at offset {}", config.maxRepetitions(), current);
                    return new ParseResult.Failure<List<T>>(
                        new ParseError.AllocationFailure(input.location(current), config.maxRepetitions()),
                        recovered);
                }
                values.add(success.value());
                recovered = ParseError.deeper(recovered, success.furthest());

                if (success.next() == current && values.size() >= min) {
                    LOGGER.trace("Zero-width match ends repetition at offset {}", current);
                    break;
                }
                current = success.next();
            }

            return new ParseResult.Success<List<T>>(Collections.unmodifiableList(values), current, recovered);
        };
    }

    // === Optional ===

    /**
     * Zero or one application of {@code parser}. Never fails; on inner failure the result is
     * absent and the position is the one this parser started at.
     */
    public static <T> Parser<Optional<T>> optional(Parser<T> parser) {
        Objects.requireNonNull(parser, "parser");

        return (input, position) -> {
            var result = parser.parse(input, position);
            if (result instanceof ParseResult.Success<T> success) {
                return new ParseResult.Success<>(Optional.ofNullable(success.value()),
                                                 success.next(),
                                                 success.furthest());
            }
            return new ParseResult.Success<Optional<T>>(Optional.empty(), position, deepest(result));
        };
    }

    // === Transformation ===

    /**
     * Apply a total function to the output; failures pass through unchanged.
     */
    public static <T, R> Parser<R> map(Parser<T> parser, Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(parser, "parser");
        Objects.requireNonNull(mapper, "mapper");

        return (input, position) -> parser.parse(input, position).map(mapper);
    }

    /**
     * Reject a successful output that does not pass {@code check}.
     * The rejection is located at the position {@code parser} started at and replaces any
     * failure recovered from inside the rejected match.
     */
    public static <T> Parser<T> validate(Parser<T> parser,
                                         Predicate<? super T> check,
                                         BiFunction<SourceSpan, ? super T, ? extends ParseError> rejection) {
        Objects.requireNonNull(parser, "parser");
        Objects.requireNonNull(check, "check");
        Objects.requireNonNull(rejection, "rejection");

        return (input, position) -> {
            var result = parser.parse(input, position);
            if (result instanceof ParseResult.Success<T> success && !check.test(success.value())) {
                var span = SourceSpan.of(input.location(position), input.location(success.next()));
                return ParseResult.failure(rejection.apply(span, success.value()));
            }
            return result;
        };
    }

    /**
     * Defer to a parser obtained when parsing, so a rule can refer to itself.
     */
    public static <T> Parser<T> lazy(Supplier<? extends Parser<T>> supplier) {
        Objects.requireNonNull(supplier, "supplier");

        return (input, position) -> supplier.get().parse(input, position);
    }

    // === Whole Input ===

    /**
     * {@code parser} followed by the end of input.
     *
     * <p>On failure the furthest failure seen during the attempt is reported, not the point
     * where {@code parser} stopped. For {@code div.1} that is the {@code 1} where a class name
     * was expected, rather than the {@code .} where the end of input was expected.
     */
    public static <T> Parser<T> phrase(Parser<T> parser) {
        var whole = leftOnly(parser, endOfInput());

        return (input, position) -> {
            var result = whole.parse(input, position);
            if (result instanceof ParseResult.Failure<T> failure) {
                var furthest = deepest(failure);
                if (furthest != failure.error()) {
                    LOGGER.trace("Reporting failure at offset {} instead of {}",
                                 furthest.location().offset(), failure.error().location().offset());
                }
                return ParseResult.failure(furthest);
            }
            return result;
        };
    }

    private static ParseError deepest(ParseResult<?> result) {
        return result.deepestFailure().orElse(null);
    }
}
