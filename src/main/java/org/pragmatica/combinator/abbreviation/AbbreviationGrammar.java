package org.pragmatica.combinator.abbreviation;

import org.pragmatica.combinator.Parsers;
import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.parser.Pair;
import org.pragmatica.combinator.parser.Parser;
import org.pragmatica.combinator.parser.ParserConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Grammar of the node abbreviation notation, assembled from combinators only.
 *
 * <pre>
 * label      = letter+
 * number     = digit+
 * node       = label (("." | "#") label)* ("*" number)?
 * expression = node (">" node)*
 * </pre>
 *
 * Children after {@code >} form a flat sibling list under the first node:
 * {@code ul>li>a} is a {@code ul} with the children {@code li} and {@code a}.
 */
public final class AbbreviationGrammar {

    public static final char CLASS_MARKER = '.';
    public static final char ID_MARKER = '#';
    public static final char COUNT_MARKER = '*';
    public static final char CHILD_SEPARATOR = '>';

    /**
     * Largest accepted repeat count. Larger numbers fail with {@link ParseError.NumericOverflow}.
     */
    public static final long MAX_COUNT = Integer.MAX_VALUE;

    private final Parser<String> label;
    private final Parser<Integer> number;
    private final Parser<String> className;
    private final Parser<String> id;
    private final Parser<Integer> count;
    private final Parser<AbbreviationNode> node;
    private final Parser<AbbreviationNode> child;
    private final Parser<AbbreviationNode> expression;
    private final Parser<AbbreviationNode> document;

    private AbbreviationGrammar(ParserConfig config) {
        label = Parsers.manyOne(Parsers.letter(), config)
                       .map(AbbreviationGrammar::text);

        var digits = Parsers.manyOne(Parsers.digit(), config)
                            .map(AbbreviationGrammar::text);
        number = digits.validate(text -> accumulate(text) <= MAX_COUNT,
                                 (span, text) -> new ParseError.NumericOverflow(span.start(), text, MAX_COUNT))
                       .map(text -> (int) accumulate(text));

        className = Parsers.rightOnly(Parsers.symbol(CLASS_MARKER), label);
        id = Parsers.rightOnly(Parsers.symbol(ID_MARKER), label);
        count = Parsers.rightOnly(Parsers.symbol(COUNT_MARKER), number);

        var attribute = Parsers.<Attribute>orElse(className.map(Attribute.ClassName::new),
                                                  id.map(Attribute.Id::new));

        node = Parsers.and(label, Parsers.and(Parsers.many(attribute, config), Parsers.optional(count)))
                      .map(AbbreviationGrammar::toNode);

        child = Parsers.rightOnly(Parsers.symbol(CHILD_SEPARATOR), node);

        expression = Parsers.and(node, Parsers.many(child, config))
                            .map(parts -> parts.first().withChildren(parts.second()));

        document = Parsers.phrase(expression);
    }

    public static AbbreviationGrammar create() {
        return create(ParserConfig.DEFAULT);
    }

    public static AbbreviationGrammar create(ParserConfig config) {
        return new AbbreviationGrammar(config);
    }

    // === Rules ===

    public Parser<String> label() {
        return label;
    }

    public Parser<Integer> number() {
        return number;
    }

    public Parser<String> className() {
        return className;
    }

    public Parser<String> id() {
        return id;
    }

    public Parser<Integer> count() {
        return count;
    }

    public Parser<AbbreviationNode> node() {
        return node;
    }

    public Parser<AbbreviationNode> child() {
        return child;
    }

    /**
     * A root node followed by its children; stops before anything it cannot parse.
     */
    public Parser<AbbreviationNode> expression() {
        return expression;
    }

    /**
     * An expression spanning the whole input. A failure names the furthest symbol that could
     * not be parsed, e.g. the {@code 1} in {@code div.1} or the digits of an oversized count.
     */
    public Parser<AbbreviationNode> document() {
        return document;
    }

    // === Reductions ===

    private sealed interface Attribute {
        record ClassName(String value) implements Attribute {}

        record Id(String value) implements Attribute {}
    }

    private static AbbreviationNode toNode(Pair<String, Pair<List<Attribute>, Optional<Integer>>> parts) {
        var classes = new ArrayList<String>();
        Optional<String> id = Optional.empty();

        // a repeated id replaces the earlier one
        for (var attribute : parts.second().first()) {
            if (attribute instanceof Attribute.ClassName name) {
                classes.add(name.value());
            } else if (attribute instanceof Attribute.Id given) {
                id = Optional.of(given.value());
            }
        }

        return new AbbreviationNode(parts.first(),
                                    String.join(" ", classes),
                                    id,
                                    parts.second().second().orElse(AbbreviationNode.DEFAULT_REPEAT_COUNT),
                                    List.of());
    }

    private static String text(List<Character> symbols) {
        var sb = new StringBuilder(symbols.size());
        symbols.forEach(sb::append);
        return sb.toString();
    }

    /**
     * Left-to-right positional value of a digit string, saturating just above {@link #MAX_COUNT}.
     */
    static long accumulate(String digits) {
        long value = 0;
        for (int i = 0; i < digits.length(); i++) {
            value = value * 10 + (digits.charAt(i) - '0');
            if (value > MAX_COUNT) {
                return MAX_COUNT + 1;
            }
        }
        return value;
    }
}
