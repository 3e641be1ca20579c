package org.pragmatica.combinator.error;

import org.pragmatica.combinator.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Rich diagnostic message for a failed parse.
 *
 * <p>Example output:
 * <pre>
 * error[E0002]: unexpected input
 *   --> 1:5
 *   |
 * 1 | div*x
 *   |     ^ found 'x'
 *   |
 *   = help: expected digit
 * </pre>
 *
 * @param code    Error code identifying the kind of failure
 * @param message Primary error message
 * @param span    Source span where the error occurred
 * @param label   Text printed next to the underline
 * @param notes   Additional notes or suggestions
 */
public record Diagnostic(
    String code,
    String message,
    SourceSpan span,
    String label,
    List<String> notes
) {
    public Diagnostic {
        notes = List.copyOf(notes);
    }

    /**
     * Describe the failure that triggered {@code error}.
     */
    public static Diagnostic of(ParseError error) {
        var root = error.root();
        var start = root.location();

        if (root instanceof ParseError.EndOfInput eoi) {
            return new Diagnostic("E0001", "unexpected end of input", SourceSpan.at(start),
                                  "expected " + eoi.expected(), List.of());
        }
        if (root instanceof ParseError.Unsatisfied unsatisfied) {
            return new Diagnostic("E0002", "unexpected input", SourceSpan.of(start, start.shift(1)),
                                  "found '" + unsatisfied.found() + "'", List.of())
                .withHelp("expected " + unsatisfied.expected());
        }
        if (root instanceof ParseError.AllocationFailure allocation) {
            return new Diagnostic("E0003", "repetition limit exceeded", SourceSpan.at(start),
                                  "more than " + allocation.limit() + " repetitions", List.of());
        }
        if (root instanceof ParseError.NumericOverflow overflow) {
            return new Diagnostic("E0004", "number too large",
                                  SourceSpan.of(start, start.shift(overflow.digits().length())),
                                  "exceeds " + overflow.limit(), List.of());
        }
        return new Diagnostic("E0000", "parse error", SourceSpan.at(start), root.message(), List.of());
    }

    /**
     * Add a note.
     */
    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(code, message, span, label, newNotes);
    }

    /**
     * Add a help suggestion.
     */
    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic with the offending source line underlined.
     *
     * @param source   The parsed text
     * @param filename Optional filename for display, may be {@code null}
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        var start = span.start();

        sb.append("error[").append(code).append("]: ").append(message).append("\n");

        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(start.line()).append(":").append(start.column()).append("\n");

        int gutterWidth = String.valueOf(start.line()).length();
        var gutter = " ".repeat(gutterWidth + 1);

        sb.append(gutter).append("|\n");
        if (start.line() <= lines.length) {
            sb.append(String.format("%" + gutterWidth + "d", start.line()))
              .append(" | ")
              .append(lines[start.line() - 1])
              .append("\n");
            sb.append(" ".repeat(gutterWidth)).append(" | ")
              .append(" ".repeat(start.column() - 1))
              .append("^".repeat(Math.max(1, span.length())));
            if (!label.isEmpty()) {
                sb.append(" ").append(label);
            }
            sb.append("\n");
        }
        sb.append(gutter).append("|\n");

        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append("\n");
        }

        return sb.toString();
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple() {
        var loc = span.start();
        return String.format("input:%d:%d: error: %s (%s)", loc.line(), loc.column(), message, label);
    }
}
