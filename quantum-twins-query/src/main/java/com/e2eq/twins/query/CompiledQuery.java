package com.e2eq.twins.query;

/**
 * Native graph query text produced by {@link TwinQueryCompiler}, together with the
 * structural facts a caller needs before executing it.
 */
public class CompiledQuery {
    private final String text;
    private final boolean requiresReadWrite;
    private final Integer limit;

    public CompiledQuery(String text, boolean requiresReadWrite, Integer limit) {
        this.text = text;
        this.requiresReadWrite = requiresReadWrite;
        this.limit = limit;
    }

    public String getText() {
        return text;
    }

    /**
     * True when the query contains a variable-length edge pattern, which read replicas
     * of the storage engine cannot execute.
     */
    public boolean requiresReadWrite() {
        return requiresReadWrite;
    }

    /**
     * Row limit from {@code TOP}, or null.
     */
    public Integer getLimit() {
        return limit;
    }

    @Override
    public String toString() {
        return "CompiledQuery{" +
                "text='" + text + '\'' +
                ", requiresReadWrite=" + requiresReadWrite +
                ", limit=" + limit +
                '}';
    }
}
