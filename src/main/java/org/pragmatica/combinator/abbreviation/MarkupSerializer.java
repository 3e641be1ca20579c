package org.pragmatica.combinator.abbreviation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Writes an abbreviation tree as a markup fragment.
 *
 * <p>Each node becomes {@code <label class="c" id="i">inner</label>} repeated
 * {@code repeatCount} times. The inner part is the serialization of the children, or the
 * configured content when there are none. Attribute values and content are escaped.
 */
public final class MarkupSerializer {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarkupSerializer.class);

    private final SerializerConfig config;

    private MarkupSerializer(SerializerConfig config) {
        this.config = config;
    }

    public static MarkupSerializer create() {
        return create(SerializerConfig.DEFAULT);
    }

    public static MarkupSerializer create(SerializerConfig config) {
        return new MarkupSerializer(Objects.requireNonNull(config, "config"));
    }

    /**
     * Serialize {@code node} into a new string.
     *
     * @throws CapacityExceededException if the output exceeds {@link SerializerConfig#maxLength()}
     */
    public String serialize(AbbreviationNode node) {
        var out = new StringBuilder();
        serialize(node, out);
        return out.toString();
    }

    /**
     * Append the serialization of {@code node} to {@code out}. The capacity limit applies to the
     * total length of {@code out}; on failure nothing has been appended.
     *
     * @throws CapacityExceededException if the output exceeds {@link SerializerConfig#maxLength()}
     */
    public void serialize(AbbreviationNode node, StringBuilder out) {
        Objects.requireNonNull(node, "node");

        if (node.isSuppressed()) {
            LOGGER.debug("Skipping <{}> with repeat count 0", node.label());
            return;
        }

        var element = element(node, out.length());
        var required = out.length() + (long) element.length() * node.repeatCount();
        checkCapacity(required);

        LOGGER.debug("Writing <{}> x{}", node.label(), node.repeatCount());
        for (int i = 0; i < node.repeatCount(); i++) {
            out.append(element);
        }
    }

    private String element(AbbreviationNode node, int offset) {
        var sb = new StringBuilder();
        sb.append('<').append(node.label());
        if (node.hasClassName()) {
            sb.append(" class=\"").append(escapeAttribute(node.className())).append('"');
        }
        node.id().ifPresent(id -> sb.append(" id=\"").append(escapeAttribute(id)).append('"'));
        sb.append('>');

        if (node.children().isEmpty()) {
            sb.append(escapeText(config.content()));
        } else {
            for (var child : node.children()) {
                if (child.isSuppressed()) {
                    continue;
                }
                var inner = element(child, offset + sb.length());
                checkCapacity(offset + sb.length() + (long) inner.length() * child.repeatCount());
                for (int i = 0; i < child.repeatCount(); i++) {
                    sb.append(inner);
                }
            }
        }

        sb.append("</").append(node.label()).append('>');
        checkCapacity(offset + (long) sb.length());
        return sb.toString();
    }

    private void checkCapacity(long required) {
        if (required > config.maxLength()) {
            throw new CapacityExceededException(config.maxLength(), required);
        }
    }

    static String escapeAttribute(String value) {
        var sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            var c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("&quot;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '&' -> sb.append("&amp;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    static String escapeText(String value) {
        var sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            var c = value.charAt(i);
            switch (c) {
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '&' -> sb.append("&amp;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
