package com.e2eq.twins.core.age;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the column list that AGE's {@code cypher()} call needs in its {@code AS (...)}
 * clause from the query's final {@code RETURN}. Aliased items keep their alias, variables
 * keep their name, property accesses are named after the property and function calls after
 * the function. Anything else is named {@code _}. {@code RETURN *} expands to the variables
 * bound by the pattern in order of appearance.
 */
final class ReturnColumns {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern ALIAS = Pattern.compile("(?is)^(.*)\\s+AS\\s+`?([A-Za-z_][A-Za-z0-9_]*)`?$");
    private static final Pattern PROPERTY = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*\\.([A-Za-z_][A-Za-z0-9_]*)$");
    private static final Pattern BRACKET_PROPERTY = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*\\[\\s*'([^']+)'\\s*]$");
    private static final Pattern FUNCTION = Pattern.compile("^([A-Za-z_][A-Za-z0-9_.]*)\\s*\\(.*\\)$", Pattern.DOTALL);
    private static final Pattern PATTERN_VARIABLE = Pattern.compile("[(\\[]\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*(?=[:)\\]*{])");
    private static final String[] CLAUSE_ENDS = {"ORDER BY", "SKIP", "LIMIT", "UNION"};

    static final String UNNAMED = "_";

    private ReturnColumns() {
    }

    /**
     * @return the column names, empty when the query has no RETURN
     */
    static List<String> of(String cypher) {
        String masked = maskLiterals(cypher);
        int returnAt = lastKeyword(masked, "RETURN");
        if (returnAt < 0) {
            return List.of();
        }
        int start = returnAt + "RETURN".length();
        int end = masked.length();
        for (String clause : CLAUSE_ENDS) {
            int at = keyword(masked, clause, start);
            if (at >= 0 && at < end) {
                end = at;
            }
        }
        String projection = cypher.substring(start, end).trim();
        if (projection.toUpperCase(Locale.ROOT).startsWith("DISTINCT ")) {
            projection = projection.substring("DISTINCT ".length()).trim();
        }
        if ("*".equals(projection)) {
            return patternVariables(masked.substring(0, returnAt));
        }

        List<String> names = new ArrayList<>();
        for (String item : splitTopLevel(projection)) {
            names.add(unique(names, nameOf(item.trim())));
        }
        return names;
    }

    private static String nameOf(String item) {
        Matcher alias = ALIAS.matcher(item);
        if (alias.matches()) {
            return alias.group(2);
        }
        if (IDENTIFIER.matcher(item).matches()) {
            return item;
        }
        Matcher property = PROPERTY.matcher(item);
        if (property.matches()) {
            return property.group(1);
        }
        Matcher bracket = BRACKET_PROPERTY.matcher(item);
        if (bracket.matches() && IDENTIFIER.matcher(bracket.group(1)).matches()) {
            return bracket.group(1);
        }
        Matcher function = FUNCTION.matcher(item);
        if (function.matches()) {
            String name = function.group(1);
            return name.substring(name.lastIndexOf('.') + 1);
        }
        return UNNAMED;
    }

    private static String unique(List<String> taken, String name) {
        if (!taken.contains(name)) {
            return name;
        }
        int i = 1;
        while (taken.contains(name + i)) {
            i++;
        }
        return name + i;
    }

    private static List<String> patternVariables(String matchPart) {
        int whereAt = keyword(matchPart, "WHERE", 0);
        String patterns = whereAt >= 0 ? matchPart.substring(0, whereAt) : matchPart;
        Set<String> variables = new LinkedHashSet<>();
        Matcher m = PATTERN_VARIABLE.matcher(patterns);
        while (m.find()) {
            variables.add(m.group(1));
        }
        return new ArrayList<>(variables);
    }

    private static List<String> splitTopLevel(String projection) {
        List<String> items = new ArrayList<>();
        String masked = maskLiterals(projection);
        int depth = 0;
        int from = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
            else if (c == ',' && depth == 0) {
                items.add(projection.substring(from, i));
                from = i + 1;
            }
        }
        items.add(projection.substring(from));
        return items;
    }

    /**
     * Replaces the content of quoted strings with spaces so keyword and delimiter searches
     * ignore them; offsets are preserved.
     */
    static String maskLiterals(String text) {
        StringBuilder out = new StringBuilder(text.length());
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\' && i + 1 < text.length()) {
                    out.append("  ");
                    i++;
                    continue;
                }
                if (c == quote) {
                    quote = 0;
                    out.append(c);
                } else {
                    out.append(' ');
                }
            } else {
                if (c == '\'' || c == '"') {
                    quote = c;
                }
                out.append(c);
            }
        }
        return out.toString();
    }

    private static int lastKeyword(String masked, String keyword) {
        int found = -1;
        int at = keyword(masked, keyword, 0);
        while (at >= 0) {
            found = at;
            at = keyword(masked, keyword, at + keyword.length());
        }
        return found;
    }

    private static int keyword(String masked, String keyword, int from) {
        Matcher m = Pattern.compile("(?i)\\b" + keyword.replace(" ", "\\s+") + "\\b").matcher(masked);
        return m.find(from) ? m.start() : -1;
    }
}
