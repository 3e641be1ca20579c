package org.pragmatica.combinator.parser;

/**
 * Parser configuration options.
 *
 * @param maxRepetitions upper bound on the number of values a single repetition may collect
 */
public record ParserConfig(int maxRepetitions) {

    public static final int DEFAULT_MAX_REPETITIONS = 1 << 20;

    public static final ParserConfig DEFAULT = new ParserConfig(DEFAULT_MAX_REPETITIONS);

    public ParserConfig {
        if (maxRepetitions < 1) {
            throw new IllegalArgumentException("maxRepetitions must be positive, got " + maxRepetitions);
        }
    }
}
