package io.sqltx.jdbc.codec;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites PostgreSQL-style numbered placeholders ({@code $1}, {@code $2}, ...) to JDBC
 * {@code ?} placeholders, reordering and repeating values to match.
 *
 * <p>String literals ({@code '...'}, {@code E'...'}), quoted identifiers, comments and
 * dollar-quoted bodies are copied untouched. A {@code $n} that continues an identifier (as in
 * {@code col$1}) is not a placeholder. Text without numbered placeholders is returned as is,
 * so statements already written with {@code ?} keep working. Once a statement uses numbered
 * placeholders, every bare {@code ?} in it is an operator (such as jsonb {@code ?}, {@code ?|}
 * and {@code ?&}) and is escaped as {@code ??} so the driver does not bind it.
 */
public final class DollarPlaceholders {

    private static final int MAX_DIGITS = 9;

    private DollarPlaceholders() {
    }

    /**
     * @throws SQLException if a placeholder refers to a value that was not supplied
     */
    public static PositionalSql rewrite(String sql, List<?> values) throws SQLException {
        StringBuilder out = new StringBuilder(sql.length() + 8);
        List<Object> ordered = new ArrayList<>();
        boolean numbered = false;
        int copied = 0;
        int length = sql.length();
        int i = 0;
        while (i < length) {
            char c = sql.charAt(i);
            char next = i + 1 < length ? sql.charAt(i + 1) : '\0';
            if (c == '\'') {
                boolean escapes = i > 0 && (sql.charAt(i - 1) == 'E' || sql.charAt(i - 1) == 'e')
                        && (i < 2 || !isIdentifierPart(sql.charAt(i - 2)));
                i = skipQuoted(sql, i, '\'', escapes);
            } else if (c == '"') {
                i = skipQuoted(sql, i, '"', false);
            } else if (c == '-' && next == '-') {
                int end = sql.indexOf('\n', i);
                i = end < 0 ? length : end + 1;
            } else if (c == '/' && next == '*') {
                i = skipBlockComment(sql, i);
            } else if (c == '$' && (i == 0 || !isIdentifierPart(sql.charAt(i - 1)))) {
                int digitsEnd = i + 1;
                while (digitsEnd < length && Character.isDigit(sql.charAt(digitsEnd))) {
                    digitsEnd++;
                }
                if (digitsEnd > i + 1) {
                    int index = placeholderIndex(sql.substring(i + 1, digitsEnd), values.size());
                    numbered = true;
                    out.append(sql, copied, i).append('?');
                    ordered.add(values.get(index - 1));
                    copied = digitsEnd;
                    i = digitsEnd;
                } else {
                    i = skipDollarQuoted(sql, i);
                }
            } else if (c == '?') {
                out.append(sql, copied, i).append("??");
                copied = i + 1;
                i++;
            } else {
                i++;
            }
        }
        if (!numbered) {
            return new PositionalSql(sql, values);
        }
        out.append(sql, copied, length);
        return new PositionalSql(out.toString(), ordered);
    }

    private static int placeholderIndex(String digits, int supplied) throws SQLException {
        if (digits.length() > MAX_DIGITS) {
            throw new SQLException("Placeholder $" + digits + " is out of range");
        }
        int index = Integer.parseInt(digits);
        if (index < 1 || index > supplied) {
            throw new SQLException("Placeholder $" + index + " has no value, " + supplied + " supplied");
        }
        return index;
    }

    private static int skipQuoted(String sql, int start, char quote, boolean backslashEscapes) {
        int i = start + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (backslashEscapes && c == '\\') {
                i += 2;
            } else if (c == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                } else {
                    return i + 1;
                }
            } else {
                i++;
            }
        }
        return sql.length();
    }

    private static int skipBlockComment(String sql, int start) {
        int depth = 0;
        int i = start;
        while (i < sql.length()) {
            if (sql.startsWith("/*", i)) {
                depth++;
                i += 2;
            } else if (sql.startsWith("*/", i)) {
                depth--;
                i += 2;
                if (depth == 0) {
                    return i;
                }
            } else {
                i++;
            }
        }
        return sql.length();
    }

    /**
     * Skips {@code $tag$ ... $tag$} starting at {@code start}; a lone {@code $} is skipped by
     * itself.
     */
    private static int skipDollarQuoted(String sql, int start) {
        int i = start + 1;
        if (i < sql.length() && isIdentifierStart(sql.charAt(i))) {
            i++;
            while (i < sql.length() && isIdentifierPart(sql.charAt(i)) && sql.charAt(i) != '$') {
                i++;
            }
        }
        if (i >= sql.length() || sql.charAt(i) != '$') {
            return start + 1;
        }
        String tag = sql.substring(start, i + 1);
        int close = sql.indexOf(tag, i + 1);
        return close < 0 ? sql.length() : close + tag.length();
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
