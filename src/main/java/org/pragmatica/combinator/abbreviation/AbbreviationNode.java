package org.pragmatica.combinator.abbreviation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One node of a parsed abbreviation such as {@code li.item#first*3}.
 *
 * @param label       element name, never empty
 * @param className   space separated class names, empty when the node has none
 * @param id          element id if one was given
 * @param repeatCount how many times the element is emitted; zero suppresses it
 * @param children    child nodes in input order
 */
public record AbbreviationNode(
    String label,
    String className,
    Optional<String> id,
    int repeatCount,
    List<AbbreviationNode> children
) {
    public static final int DEFAULT_REPEAT_COUNT = 1;

    public AbbreviationNode {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(className, "className");
        Objects.requireNonNull(id, "id");
        if (label.isEmpty()) {
            throw new IllegalArgumentException("Label must not be empty");
        }
        if (repeatCount < 0) {
            throw new IllegalArgumentException("Negative repeat count " + repeatCount);
        }
        children = List.copyOf(children);
    }

    /**
     * Node with no class, no id, repeat count 1 and no children.
     */
    public static AbbreviationNode of(String label) {
        return new AbbreviationNode(label, "", Optional.empty(), DEFAULT_REPEAT_COUNT, List.of());
    }

    public AbbreviationNode withClassName(String className) {
        return new AbbreviationNode(label, className, id, repeatCount, children);
    }

    public AbbreviationNode withId(String id) {
        return new AbbreviationNode(label, className, Optional.of(id), repeatCount, children);
    }

    public AbbreviationNode withRepeatCount(int repeatCount) {
        return new AbbreviationNode(label, className, id, repeatCount, children);
    }

    public AbbreviationNode withChildren(List<AbbreviationNode> children) {
        return new AbbreviationNode(label, className, id, repeatCount, children);
    }

    public boolean hasClassName() {
        return !className.isEmpty();
    }

    public boolean isSuppressed() {
        return repeatCount == 0;
    }
}
