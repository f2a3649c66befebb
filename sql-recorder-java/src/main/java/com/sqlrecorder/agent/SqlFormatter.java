package com.sqlrecorder.agent;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pretty-prints captured statements for display: keywords upper-cased, one line per major clause,
 * top-level AND/OR conditions indented below their clause.
 *
 * Statements JSqlParser understands are first normalized through its deparser; anything else
 * (vendor syntax, partial statements) is formatted token by token from the raw text. The deparser
 * discards comments, so statements carrying any are laid out from the raw text as well.
 * String literals, quoted identifiers and comments are never altered; a line comment always ends
 * its line.
 */
public final class SqlFormatter {

    private static final Logger log = LoggerFactory.getLogger(SqlFormatter.class);

    static final Set<String> KEYWORDS = Set.of(
        "SELECT", "FROM", "WHERE", "AND", "OR", "NOT", "IN", "IS", "NULL", "LIKE", "ILIKE", "BETWEEN",
        "AS", "ON", "USING", "JOIN", "LEFT", "RIGHT", "INNER", "OUTER", "FULL", "CROSS", "NATURAL",
        "GROUP", "BY", "ORDER", "HAVING", "LIMIT", "OFFSET", "FETCH", "FIRST", "NEXT", "ROWS", "ONLY",
        "UNION", "INTERSECT", "EXCEPT", "ALL", "DISTINCT", "INSERT", "INTO", "VALUES", "UPDATE", "SET",
        "DELETE", "CASE", "WHEN", "THEN", "ELSE", "END", "ASC", "DESC", "EXISTS", "TRUE", "FALSE",
        "FOR", "RETURNING", "WITH", "CREATE", "TABLE", "DROP", "ALTER", "INDEX", "PRIMARY", "KEY",
        "DEFAULT", "DUPLICATE", "IF", "REPLACE", "IGNORE", "SHOW", "LOCK", "SHARE", "MODE", "TRUNCATE"
    );

    /** Clauses that start a new line at nesting depth 0, longest first. */
    private static final List<String[]> CLAUSES = List.of(
        new String[]{"LEFT", "OUTER", "JOIN"},
        new String[]{"RIGHT", "OUTER", "JOIN"},
        new String[]{"FULL", "OUTER", "JOIN"},
        new String[]{"ON", "DUPLICATE", "KEY", "UPDATE"},
        new String[]{"LEFT", "JOIN"},
        new String[]{"RIGHT", "JOIN"},
        new String[]{"INNER", "JOIN"},
        new String[]{"CROSS", "JOIN"},
        new String[]{"FULL", "JOIN"},
        new String[]{"GROUP", "BY"},
        new String[]{"ORDER", "BY"},
        new String[]{"UNION", "ALL"},
        new String[]{"INSERT", "INTO"},
        new String[]{"DELETE", "FROM"},
        new String[]{"SELECT"},
        new String[]{"FROM"},
        new String[]{"WHERE"},
        new String[]{"HAVING"},
        new String[]{"LIMIT"},
        new String[]{"OFFSET"},
        new String[]{"UNION"},
        new String[]{"INTERSECT"},
        new String[]{"EXCEPT"},
        new String[]{"JOIN"},
        new String[]{"VALUES"},
        new String[]{"UPDATE"},
        new String[]{"SET"},
        new String[]{"RETURNING"}
    );

    private static final String CONDITION_INDENT = "  ";

    private final boolean enabled;

    public SqlFormatter(boolean enabled) {
        this.enabled = enabled;
    }

    public String format(String sql) {
        if (sql == null) return "";
        String trimmed = sql.strip();
        if (!enabled || trimmed.isEmpty()) return trimmed;
        List<Token> raw = tokenize(trimmed);
        if (hasComment(raw)) return reindent(raw);
        return reindent(tokenize(normalize(trimmed)));
    }

    private static boolean hasComment(List<Token> tokens) {
        for (Token token : tokens) {
            if (token.kind() == Kind.COMMENT) return true;
        }
        return false;
    }

    static String normalize(String sql) {
        try {
            return CCJSqlParserUtil.parse(sql).toString();
        } catch (JSQLParserException | RuntimeException e) {
            log.debug("statement not parseable, formatting raw text: {}", e.getMessage());
            return sql;
        }
    }

    // -----------------------------------------------------------------------
    // Tokenizer
    // -----------------------------------------------------------------------

    enum Kind { WORD, QUOTED, COMMENT, SPACE, SYMBOL }

    record Token(Kind kind, String text) {}

    static List<Token> tokenize(String sql) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            int start = i;
            if (Character.isWhitespace(c)) {
                while (i < n && Character.isWhitespace(sql.charAt(i))) i++;
                tokens.add(new Token(Kind.SPACE, " "));
            } else if (c == '\'' || c == '"' || c == '`') {
                i = skipQuoted(sql, i, c);
                tokens.add(new Token(Kind.QUOTED, sql.substring(start, i)));
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                while (i < n && sql.charAt(i) != '\n') i++;
                tokens.add(new Token(Kind.COMMENT, sql.substring(start, i)));
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                i = close < 0 ? n : close + 2;
                tokens.add(new Token(Kind.COMMENT, sql.substring(start, i)));
            } else if (Character.isLetter(c) || c == '_') {
                while (i < n && isWordPart(sql.charAt(i))) i++;
                tokens.add(new Token(Kind.WORD, sql.substring(start, i)));
            } else {
                i++;
                tokens.add(new Token(Kind.SYMBOL, String.valueOf(c)));
            }
        }
        return tokens;
    }

    /** Returns the index just past the quoted run starting at {@code start}; doubled quotes escape. */
    static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\\' && quote == '\'' && i + 1 < n) {
                i += 2;
                continue;
            }
            if (c == quote) {
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

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    // -----------------------------------------------------------------------
    // Layout
    // -----------------------------------------------------------------------

    static String reindent(List<Token> tokens) {
        StringBuilder out = new StringBuilder();
        int depth = 0;
        boolean pendingSpace = false;
        boolean inBetween = false;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            switch (token.kind()) {
                case SPACE -> pendingSpace = true;
                case WORD -> {
                    String upper = token.text().toUpperCase(Locale.ROOT);
                    if (depth == 0) {
                        int consumed = matchClause(tokens, i);
                        if (consumed > 0) {
                            StringBuilder clause = new StringBuilder();
                            for (int j = i; j < consumed; j++) {
                                Token t = tokens.get(j);
                                if (t.kind() == Kind.WORD) {
                                    if (clause.length() > 0) clause.append(' ');
                                    clause.append(t.text().toUpperCase(Locale.ROOT));
                                }
                            }
                            newLine(out);
                            out.append(clause);
                            pendingSpace = false;
                            i = consumed - 1;
                            continue;
                        }
                        if ((upper.equals("AND") && !inBetween) || upper.equals("OR")) {
                            newLine(out);
                            out.append(CONDITION_INDENT).append(upper);
                            pendingSpace = false;
                            continue;
                        }
                    }
                    if (upper.equals("BETWEEN")) {
                        inBetween = true;
                    } else if (upper.equals("AND")) {
                        inBetween = false;
                    }
                    appendToken(out, KEYWORDS.contains(upper) ? upper : token.text(), pendingSpace);
                    pendingSpace = false;
                }
                case SYMBOL -> {
                    if (token.text().equals("(")) depth++;
                    if (token.text().equals(")")) depth = Math.max(0, depth - 1);
                    appendToken(out, token.text(), pendingSpace);
                    pendingSpace = false;
                }
                case COMMENT -> {
                    appendToken(out, token.text(), pendingSpace);
                    if (token.text().startsWith("--")) out.append('\n');
                    pendingSpace = false;
                }
                default -> {
                    appendToken(out, token.text(), pendingSpace);
                    pendingSpace = false;
                }
            }
        }
        return out.toString().strip();
    }

    /**
     * If a clause starts at {@code index}, returns the token index just past it; otherwise 0.
     */
    static int matchClause(List<Token> tokens, int index) {
        for (String[] clause : CLAUSES) {
            int i = index;
            int matched = 0;
            while (matched < clause.length && i < tokens.size()) {
                Token t = tokens.get(i);
                if (t.kind() == Kind.SPACE) {
                    i++;
                    continue;
                }
                if (t.kind() != Kind.WORD || !t.text().equalsIgnoreCase(clause[matched])) break;
                matched++;
                i++;
            }
            if (matched == clause.length) return i;
        }
        return 0;
    }

    private static void newLine(StringBuilder out) {
        if (out.length() > 0 && out.charAt(out.length() - 1) != '\n') out.append('\n');
    }

    private static void appendToken(StringBuilder out, String text, boolean space) {
        if (space && out.length() > 0 && out.charAt(out.length() - 1) != '\n') {
            out.append(' ');
        }
        out.append(text);
    }
}
