package com.enterprise.morpher.sql.validation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guards the raw SQL a migration config contributes: table and column names,
 * join ON clauses and ORDER BY fragments. Row values never pass through here,
 * they are always bound as parameters.
 *
 * <p>Expressions are checked with their quoted string literals blanked out, so
 * {@code profiles.kind = 'update'} is accepted while {@code ... ; UPDATE users}
 * is not.
 */
public final class ExpressionValidator {

    private ExpressionValidator() {}

    // letter or underscore first; dots separate schema, table and column parts
    private static final Pattern IDENTIFIER_PATTERN =
            Pattern.compile("[a-zA-Z_][a-zA-Z0-9_$]*(\\.[a-zA-Z_][a-zA-Z0-9_$]*)*");

    private static final Pattern STATEMENT_KEYWORDS = Pattern.compile(
            "(?i)\\b(DROP|DELETE|INSERT|UPDATE|MERGE|ALTER|CREATE|TRUNCATE|EXEC|EXECUTE|GRANT|REVOKE)\\b");

    private static final Pattern COMMENT_OR_TERMINATOR = Pattern.compile("--|/\\*|\\*/|;");

    /**
     * @throws IllegalArgumentException for anything but a plain or dot-qualified name
     */
    public static void validateIdentifier(String identifier) {
        if (identifier == null || !IDENTIFIER_PATTERN.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid identifier: " + identifier);
        }
        Matcher keyword = STATEMENT_KEYWORDS.matcher(identifier);
        if (keyword.find()) {
            throw new IllegalArgumentException(
                    "Identifier '" + identifier + "' is the keyword " + keyword.group(1).toUpperCase());
        }
    }

    /**
     * @throws IllegalArgumentException if the fragment is blank, has an unterminated
     *                                  literal, or contains a statement keyword, a
     *                                  comment or a statement terminator outside literals
     */
    public static void validateExpression(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Expression cannot be null or blank");
        }
        String code = blankLiterals(expression);
        Matcher keyword = STATEMENT_KEYWORDS.matcher(code);
        if (keyword.find()) {
            throw new IllegalArgumentException(
                    "Keyword " + keyword.group(1).toUpperCase() + " not allowed in expression: " + expression);
        }
        Matcher marker = COMMENT_OR_TERMINATOR.matcher(code);
        if (marker.find()) {
            throw new IllegalArgumentException(
                    "'" + marker.group() + "' not allowed in expression: " + expression);
        }
    }

    /**
     * Replaces every single-quoted literal with {@code ''}, honouring doubled quotes.
     *
     * @throws IllegalArgumentException on an unterminated literal
     */
    public static String blankLiterals(String expression) {
        StringBuilder out = new StringBuilder(expression.length());
        int i = 0;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (c != '\'') {
                out.append(c);
                i++;
                continue;
            }
            int end = i + 1;
            while (true) {
                if (end >= expression.length()) {
                    throw new IllegalArgumentException("Unterminated string literal in expression: " + expression);
                }
                if (expression.charAt(end) == '\'') {
                    if (end + 1 < expression.length() && expression.charAt(end + 1) == '\'') {
                        end += 2;
                        continue;
                    }
                    break;
                }
                end++;
            }
            out.append("''");
            i = end + 1;
        }
        return out.toString();
    }
}
