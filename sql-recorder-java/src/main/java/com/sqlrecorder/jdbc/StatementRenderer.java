package com.sqlrecorder.jdbc;

import java.time.temporal.TemporalAccessor;
import java.util.Date;

/**
 * Renders the literal text of a parameterized statement, the way it reaches the database.
 *
 * Each {@code ?} outside string literals, quoted identifiers and comments is replaced by the
 * next bound value. Placeholders without a value are left as they are.
 */
public final class StatementRenderer {

    private StatementRenderer() {}

    public static String render(String sql, Object[] params) {
        if (sql == null) return null;
        if (params == null || params.length == 0) return sql;

        StringBuilder out = new StringBuilder(sql.length() + params.length * 8);
        int next = 0;
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"' || c == '`') {
                int end = skipQuoted(sql, i, c);
                out.append(sql, i, end);
                i = end;
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                end = end < 0 ? n : end;
                out.append(sql, i, end);
                i = end;
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                int end = close < 0 ? n : close + 2;
                out.append(sql, i, end);
                i = end;
            } else if (c == '?' && next < params.length) {
                out.append(literal(params[next++]));
                i++;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /** SQL literal for a bound value. */
    static String literal(Object value) {
        if (value == null) return "NULL";
        if (value instanceof Number || value instanceof Boolean) return value.toString();
        if (value instanceof byte[] bytes) {
            StringBuilder hex = new StringBuilder("X'");
            for (byte b : bytes) {
                hex.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
            }
            return hex.append('\'').toString();
        }
        if (value instanceof TemporalAccessor || value instanceof Date) {
            return quote(value.toString());
        }
        return quote(String.valueOf(value));
    }

    private static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        int n = sql.length();
        while (i < n) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < n && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return n;
    }
}
