package com.e2eq.twins.core.query;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites graph query text for one page: folds the continuation row number into {@code SKIP}
 * and caps {@code LIMIT} at the page size.
 */
final class QueryPaging {
    static final Pattern SKIP = Pattern.compile("SKIP\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
    static final Pattern LIMIT = Pattern.compile("LIMIT\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
    static final Pattern VARIABLE_LENGTH_EDGE = Pattern.compile("\\[[^\\]]*(?::\\w*)?\\*[\\d.]*\\]");

    private QueryPaging() {
    }

    /**
     * @param rowNumber rows already returned by earlier pages, 0 for the first page
     */
    static Paged page(String cypher, int rowNumber, int pageSize) {
        Matcher skip = SKIP.matcher(cypher);
        Matcher limit = LIMIT.matcher(cypher);
        boolean hasSkip = skip.find();
        boolean hasLimit = limit.find();
        String text = cypher;

        if (hasSkip) {
            int newSkip = Integer.parseInt(skip.group(1)) + rowNumber;
            text = SKIP.matcher(text).replaceAll("SKIP " + newSkip);
        } else if (hasLimit && rowNumber > 0) {
            text = LIMIT.matcher(text).replaceAll("").trim() + " SKIP " + rowNumber + " LIMIT " + limit.group(1);
        } else if (rowNumber > 0) {
            text = text + " SKIP " + rowNumber;
        }

        int existingLimit = Integer.MAX_VALUE;
        if (hasLimit) {
            existingLimit = Integer.parseInt(limit.group(1));
            // the query's own LIMIT counts rows across all pages
            int remaining = Math.max(0, existingLimit - rowNumber);
            int effective = Math.min(pageSize, remaining);
            if (effective != existingLimit) {
                text = LIMIT.matcher(text).replaceAll("LIMIT " + effective);
            }
        } else {
            text = text + " LIMIT " + pageSize;
        }
        return new Paged(text, existingLimit);
    }

    static boolean isVariableLength(String cypher) {
        return VARIABLE_LENGTH_EDGE.matcher(cypher).find();
    }

    /**
     * @param existingLimit the query's own LIMIT, {@link Integer#MAX_VALUE} when it has none
     */
    record Paged(String text, int existingLimit) {}
}
