package org.carball.plandoctor.parser;

import java.util.regex.Pattern;

/**
 * Reduces SQL text to a grouping key by replacing literals with placeholders.
 * <p>
 * This is a textual heuristic, not a parser: it is good enough to group executions of the
 * same statement shape and must not be used to rewrite SQL.
 */
public class QueryFingerprinter {

    public static final String NUMBER_PLACEHOLDER = "N";
    public static final String STRING_PLACEHOLDER = "S";
    public static final String ARRAY_PLACEHOLDER = "A";
    public static final String JSON_PLACEHOLDER = "J";

    private static final Pattern NUMBER_LITERAL = Pattern.compile("\\b\\d+\\b");
    private static final Pattern STRING_LITERAL = Pattern.compile("'[^']*'");
    private static final Pattern ARRAY_LITERAL = Pattern.compile("\\[[^\\]]*\\]");
    private static final Pattern JSON_LITERAL = Pattern.compile("\\{[^}]*\\}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private QueryFingerprinter() {
        // Utility class - prevent instantiation
    }

    public static String fingerprint(String query) {
        if (query == null) {
            return "";
        }

        // Order matters: numbers inside string literals are folded before the string itself
        String normalized = NUMBER_LITERAL.matcher(query).replaceAll(NUMBER_PLACEHOLDER);
        normalized = STRING_LITERAL.matcher(normalized).replaceAll(STRING_PLACEHOLDER);
        normalized = ARRAY_LITERAL.matcher(normalized).replaceAll(ARRAY_PLACEHOLDER);
        normalized = JSON_LITERAL.matcher(normalized).replaceAll(JSON_PLACEHOLDER);

        return WHITESPACE.matcher(normalized).replaceAll(" ").trim();
    }
}
