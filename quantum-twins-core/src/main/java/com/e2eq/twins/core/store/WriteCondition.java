package com.e2eq.twins.core.store;

/**
 * Condition evaluated by the store inside the write statement itself.
 */
public record WriteCondition(Type type, String etag) {

    public enum Type {
        /** Unconditional upsert. */
        NONE,
        /** Write only if no entity with the key exists. */
        IF_ABSENT,
        /** Write only if the stored entity carries {@link #etag()}. */
        IF_MATCH
    }

    private static final WriteCondition NONE_CONDITION = new WriteCondition(Type.NONE, null);
    private static final WriteCondition ABSENT_CONDITION = new WriteCondition(Type.IF_ABSENT, null);

    public WriteCondition {
        if (type == Type.IF_MATCH && etag == null) {
            throw new IllegalArgumentException("IF_MATCH requires an etag");
        }
    }

    public static WriteCondition none() {
        return NONE_CONDITION;
    }

    public static WriteCondition ifAbsent() {
        return ABSENT_CONDITION;
    }

    public static WriteCondition ifMatch(String etag) {
        return new WriteCondition(Type.IF_MATCH, etag);
    }

    /**
     * {@code null} and {@code *} impose no condition; any other value must match the stored etag.
     */
    public static WriteCondition fromIfMatch(String ifMatch) {
        return ifMatch == null || "*".equals(ifMatch) ? none() : ifMatch(ifMatch);
    }
}
