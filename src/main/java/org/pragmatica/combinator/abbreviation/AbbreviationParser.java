package org.pragmatica.combinator.abbreviation;

import org.pragmatica.combinator.parser.Input;
import org.pragmatica.combinator.parser.ParseResult;
import org.pragmatica.combinator.parser.ParserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for parsing and expanding node abbreviations.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = AbbreviationParser.create();
 *
 * var tree = parser.parse("ul>li*2").unwrap();
 * var markup = parser.expand("ul>li*2", MarkupSerializer.create()).unwrap();
 * }</pre>
 */
public final class AbbreviationParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbbreviationParser.class);

    private final AbbreviationGrammar grammar;

    private AbbreviationParser(AbbreviationGrammar grammar) {
        this.grammar = grammar;
    }

    public static AbbreviationParser create() {
        return create(ParserConfig.DEFAULT);
    }

    public static AbbreviationParser create(ParserConfig config) {
        return new AbbreviationParser(AbbreviationGrammar.create(config));
    }

    /**
     * Parse the whole text as one abbreviation.
     */
    public ParseResult<AbbreviationNode> parse(String text) {
        return parse(Input.of(text));
    }

    /**
     * Parse bytes as one abbreviation, each byte being one symbol.
     */
    public ParseResult<AbbreviationNode> parse(byte[] bytes) {
        return parse(Input.of(bytes));
    }

    public ParseResult<AbbreviationNode> parse(Input input) {
        LOGGER.debug("Parsing abbreviation |{}|", input);

        var result = grammar.document().parse(input, 0);

        if (result instanceof ParseResult.Failure<AbbreviationNode> failure) {
            LOGGER.debug("Abbreviation |{}| rejected: {}", input, failure.error().message());
        }
        return result;
    }

    /**
     * Parse the text and serialize the resulting tree. Capacity errors of the serializer are thrown,
     * see {@link MarkupSerializer#serialize(AbbreviationNode)}.
     */
    public ParseResult<String> expand(String text, MarkupSerializer serializer) {
        return parse(text).map(serializer::serialize);
    }

    public AbbreviationGrammar grammar() {
        return grammar;
    }

    /**
     * Create a builder for parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxRepetitions = ParserConfig.DEFAULT_MAX_REPETITIONS;

        private Builder() {}

        public Builder maxRepetitions(int maxRepetitions) {
            this.maxRepetitions = maxRepetitions;
            return this;
        }

        public AbbreviationParser build() {
            return create(new ParserConfig(maxRepetitions));
        }
    }
}
