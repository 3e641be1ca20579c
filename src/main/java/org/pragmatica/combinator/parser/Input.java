package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.tree.SourceLocation;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable, randomly indexable sequence of symbols that parsers read from.
 *
 * <p>Symbols are characters. Byte input is viewed as unsigned 8-bit symbols, so
 * byte {@code 0xE9} is the symbol {@code 'é'}.
 */
public final class Input {

    private static final int PREVIEW_LENGTH = 32;

    private final String symbols;
    private final int[] lineStarts;

    private Input(String symbols) {
        this.symbols = symbols;
        this.lineStarts = lineStarts(symbols);
    }

    private static int[] lineStarts(String text) {
        var starts = new int[16];
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, count);
    }

    public static Input of(CharSequence text) {
        Objects.requireNonNull(text, "text");
        return new Input(text.toString());
    }

    public static Input of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new Input(new String(bytes, StandardCharsets.ISO_8859_1));
    }

    public int length() {
        return symbols.length();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public boolean isAtEnd(int position) {
        return position >= symbols.length();
    }

    public char symbolAt(int position) {
        return symbols.charAt(position);
    }

    public String slice(int start, int end) {
        return symbols.substring(start, end);
    }

    /**
     * Resolve an offset to line and column in logarithmic time. Offsets past the end resolve
     * to the end of input.
     */
    public SourceLocation location(int position) {
        if (position < 0) {
            throw new IndexOutOfBoundsException("Negative position " + position);
        }
        var limit = Math.min(position, symbols.length());
        var found = Arrays.binarySearch(lineStarts, limit);
        var line = found >= 0 ? found : -found - 2;
        return SourceLocation.at(line + 1, limit - lineStarts[line] + 1, limit);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Input other && symbols.equals(other.symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return symbols.length() <= PREVIEW_LENGTH
            ? symbols
            : symbols.substring(0, PREVIEW_LENGTH) + "...";
    }
}
