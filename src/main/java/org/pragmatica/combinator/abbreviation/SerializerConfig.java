package org.pragmatica.combinator.abbreviation;

import java.util.Objects;

/**
 * Serializer configuration options.
 *
 * @param content   text placed inside elements that have no children
 * @param maxLength largest output the serializer may produce, in characters
 */
public record SerializerConfig(String content, int maxLength) {

    /**
     * 64 MiB of characters.
     */
    public static final int DEFAULT_MAX_LENGTH = 64 * 1024 * 1024;

    /**
     * Largest capacity a single {@link StringBuilder} can be asked for.
     */
    public static final int MAX_LENGTH_LIMIT = Integer.MAX_VALUE - 8;

    public static final SerializerConfig DEFAULT = new SerializerConfig("", DEFAULT_MAX_LENGTH);

    public SerializerConfig {
        Objects.requireNonNull(content, "content");
        if (maxLength < 0 || maxLength > MAX_LENGTH_LIMIT) {
            throw new IllegalArgumentException("maxLength must be between 0 and " + MAX_LENGTH_LIMIT
                                               + ", got " + maxLength);
        }
    }

    public SerializerConfig withContent(String content) {
        return new SerializerConfig(content, maxLength);
    }

    public SerializerConfig withMaxLength(int maxLength) {
        return new SerializerConfig(content, maxLength);
    }
}
