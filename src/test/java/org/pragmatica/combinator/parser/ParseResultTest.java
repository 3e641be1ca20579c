package org.pragmatica.combinator.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.tree.SourceLocation;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ParseResult variants and their operations.
 */
class ParseResultTest {

    private static final SourceLocation LOC = SourceLocation.at(1, 3, 2);
    private static final ParseError ERROR = new ParseError.Unsatisfied(LOC, "x", "digit");

    // === Success Tests ===

    @Test
    void success_isSuccess_returnsTrue() {
        var result = ParseResult.success("abc", 3);

        assertTrue(result.isSuccess());
        assertFalse(result.isFailure());
    }

    @Test
    void success_preservesValueAndNext() {
        var result = (ParseResult.Success<String>) ParseResult.success("abc", 3);

        assertEquals("abc", result.value());
        assertEquals(3, result.next());
        assertEquals("abc", result.unwrap());
    }

    @Test
    void success_map_keepsPosition() {
        var result = ParseResult.success("42", 2).map(Integer::parseInt);

        assertEquals(ParseResult.success(42, 2), result);
    }

    @Test
    void success_withNullValue_toOptionalIsEmpty() {
        var result = ParseResult.success(null, 0);

        assertTrue(result.isSuccess());
        assertEquals(Optional.empty(), result.toOptional());
    }

    @Test
    void success_fold_usesSuccessBranch() {
        var folded = ParseResult.success(5, 1).fold(error -> -1, value -> value * 2);

        assertEquals(10, folded);
    }

    @Test
    void success_negativeNext_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ParseResult.success("x", -1));
    }

    // === Failure Tests ===

    @Test
    void failure_isFailure_returnsTrue() {
        var result = ParseResult.<String>failure(ERROR);

        assertFalse(result.isSuccess());
        assertTrue(result.isFailure());
    }

    @Test
    void failure_map_passesErrorThrough() {
        var mapped = ParseResult.<String>failure(ERROR).map(String::length);

        assertEquals(ParseResult.failure(ERROR), mapped);
    }

    @Test
    void failure_fold_usesFailureBranch() {
        var folded = ParseResult.<Integer>failure(ERROR).fold(ParseError::expected, value -> "value " + value);

        assertEquals("digit", folded);
    }

    @Test
    void failure_unwrap_throwsWithMessage() {
        var result = ParseResult.<String>failure(ERROR);

        var thrown = assertThrows(IllegalStateException.class, result::unwrap);
        assertEquals("Unexpected 'x' at 1:3, expected digit", thrown.getMessage());
    }

    @Test
    void failure_toOptional_isEmpty() {
        assertTrue(ParseResult.failure(ERROR).toOptional().isEmpty());
    }

    @Test
    void failure_retype_keepsError() {
        var failure = new ParseResult.Failure<String>(ERROR);

        ParseResult.Failure<Integer> retyped = failure.retype();

        assertSame(ERROR, retyped.error());
    }

    // === Error Tests ===

    @Test
    void sequenceFailure_delegatesToCause() {
        var wrapped = ParseError.SequenceFailure.of(ERROR);

        assertEquals(LOC, wrapped.location());
        assertEquals("digit", wrapped.expected());
        assertSame(ERROR, wrapped.root());
        assertEquals(ERROR.message(), wrapped.message());
    }

    @Test
    void sequenceFailure_isNotWrappedTwice() {
        var wrapped = ParseError.SequenceFailure.of(ERROR);

        assertSame(wrapped, ParseError.SequenceFailure.of(wrapped));
    }

    @Test
    void endOfInput_message() {
        var error = new ParseError.EndOfInput(SourceLocation.START, "letter");

        assertEquals("Unexpected end of input at 1:1, expected letter", error.message());
    }
}
