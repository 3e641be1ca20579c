package org.pragmatica.combinator.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.combinator.abbreviation.AbbreviationParser;
import org.pragmatica.combinator.parser.ParseResult;
import org.pragmatica.combinator.tree.SourceLocation;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    private static Diagnostic diagnose(String text) {
        var result = AbbreviationParser.create().parse(text);
        return Diagnostic.of(((ParseResult.Failure<?>) result).error());
    }

    @Test
    void unsatisfied_formatsUnderlinedSource() {
        var diagnostic = diagnose("div!");

        assertEquals("E0002", diagnostic.code());
        assertEquals("error[E0002]: unexpected input\n"
                     + "  --> 1:4\n"
                     + "  |\n"
                     + "1 | div!\n"
                     + "  |    ^ found '!'\n"
                     + "  |\n"
                     + "  = help: expected end of input\n",
                     diagnostic.format("div!", null));
    }

    @Test
    void brokenClassName_pointsAtOffendingSymbol() {
        var diagnostic = diagnose("div.1");

        assertEquals("error[E0002]: unexpected input\n"
                     + "  --> 1:5\n"
                     + "  |\n"
                     + "1 | div.1\n"
                     + "  |     ^ found '1'\n"
                     + "  |\n"
                     + "  = help: expected letter\n",
                     diagnostic.format("div.1", null));
    }

    @Test
    void oversizedCount_reportsNumberTooLarge() {
        var diagnostic = diagnose("div*99999999999");

        assertEquals("E0004", diagnostic.code());
        assertEquals("number too large", diagnostic.message());
        assertEquals("99999999999", diagnostic.span().extract("div*99999999999"));
    }

    @Test
    void endOfInput_pointsPastLastSymbol() {
        var diagnostic = diagnose("");

        assertEquals("E0001", diagnostic.code());
        assertEquals("expected letter", diagnostic.label());
        assertTrue(diagnostic.span().isEmpty());
    }

    @Test
    void numericOverflow_spansDigits() {
        var error = new ParseError.NumericOverflow(SourceLocation.at(1, 5, 4), "99999999999", 2147483647L);

        var diagnostic = Diagnostic.of(ParseError.SequenceFailure.of(error));

        assertEquals("E0004", diagnostic.code());
        assertEquals(11, diagnostic.span().length());
        assertEquals("99999999999", diagnostic.span().extract("div*99999999999"));
    }

    @Test
    void allocationFailure_hasOwnCode() {
        var error = new ParseError.AllocationFailure(SourceLocation.START, 8);

        var diagnostic = Diagnostic.of(error);

        assertEquals("E0003", diagnostic.code());
        assertEquals("more than 8 repetitions", diagnostic.label());
    }

    @Test
    void format_includesFilename() {
        var formatted = diagnose("ul>").format("ul>", "menu.abbr");

        assertTrue(formatted.contains("  --> menu.abbr:1:4\n"), formatted);
    }

    @Test
    void formatSimple_isSingleLine() {
        assertEquals("input:1:4: error: unexpected input (found '!')", diagnose("div!").formatSimple());
    }

    @Test
    void withNote_keepsOriginalUnchanged() {
        var diagnostic = diagnose("div!");

        var extended = diagnostic.withNote("abbreviations end after the last node");

        assertEquals(List.of("help: expected end of input"), diagnostic.notes());
        assertEquals(2, extended.notes().size());
    }
}
