package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.Parsers;
import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.tree.SourceSpan;

import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Parser interface - a pure function from a position in the input to a {@link ParseResult}.
 *
 * <p>The output type of a composed parser follows from the output types of its operands,
 * so an ill-typed grammar does not compile. The fluent methods delegate to {@link Parsers}.
 */
@FunctionalInterface
public interface Parser<T> {

    /**
     * Parse input starting at {@code position}.
     */
    ParseResult<T> parse(Input input, int position);

    /**
     * Parse text starting at its first symbol.
     */
    default ParseResult<T> parse(String text) {
        return parse(Input.of(text), 0);
    }

    default <R> Parser<R> map(Function<? super T, ? extends R> mapper) {
        return Parsers.map(this, mapper);
    }

    default <U> Parser<Pair<T, U>> and(Parser<U> next) {
        return Parsers.and(this, next);
    }

    default <U> Parser<U> andThen(Parser<U> next) {
        return Parsers.andThen(this, next);
    }

    default Parser<T> skip(Parser<?> next) {
        return Parsers.leftOnly(this, next);
    }

    default Parser<T> or(Parser<? extends T> alternative) {
        return Parsers.orElse(this, alternative);
    }

    default Parser<List<T>> many() {
        return Parsers.many(this);
    }

    default Parser<List<T>> manyOne() {
        return Parsers.manyOne(this);
    }

    default Parser<List<T>> times(int min, int max) {
        return Parsers.times(this, min, max);
    }

    default Parser<Optional<T>> optional() {
        return Parsers.optional(this);
    }

    default Parser<T> validate(Predicate<? super T> check,
                               BiFunction<SourceSpan, ? super T, ? extends ParseError> rejection) {
        return Parsers.validate(this, check, rejection);
    }
}
