package org.pragmatica.combinator.abbreviation;

/**
 * Serialized output would not fit the configured maximum length.
 */
public final class CapacityExceededException extends RuntimeException {

    private final long limit;
    private final long required;

    public CapacityExceededException(long limit, long required) {
        super("Output of " + required + " characters exceeds capacity of " + limit);
        this.limit = limit;
        this.required = required;
    }

    public long limit() {
        return limit;
    }

    public long required() {
        return required;
    }
}
