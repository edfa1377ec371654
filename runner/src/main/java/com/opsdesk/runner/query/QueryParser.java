package com.opsdesk.runner.query;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser for the query chain grammar:
 * <pre>
 *   chain := call ( '->' call )*
 *   call  := IDENT '(' [ arg ( ',' arg )* ] ')'
 *   arg   := STRING | NUMBER | true | false | null | list | call
 *   list  := '[' [ arg ( ',' arg )* ] ']'
 * </pre>
 * A single leading {@code Entity::} or {@code ->} is tolerated. Identifiers
 * are ASCII only, whitespace is space, tab, CR or LF; anything else outside
 * a string literal is a syntax error. There is no recovery: the first problem
 * ends parsing.
 */
public final class QueryParser {

    static final int MAX_LENGTH = 10_000;
    static final int MAX_DEPTH  = 16;

    private final String src;
    private int pos;
    private int depth;

    private QueryParser(String src) {
        this.src = src;
    }

    /**
     * Parse {@code expression} into a chain. A blank expression yields an
     * empty chain.
     *
     * @throws QuerySyntaxException if the expression does not follow the grammar
     */
    public static QueryChain parse(String expression) {
        if (expression == null) {
            throw new QuerySyntaxException("Query is missing", 0);
        }
        if (expression.length() > MAX_LENGTH) {
            throw new QuerySyntaxException("Query is longer than " + MAX_LENGTH + " characters", MAX_LENGTH);
        }
        return new QueryParser(expression).chain();
    }

    // ------------------------------------------------------------------
    // Grammar
    // ------------------------------------------------------------------

    private QueryChain chain() {
        List<QueryCall> calls = new ArrayList<>();
        skipWhitespace();
        if (atEnd()) return new QueryChain(calls);

        skipPrefix();
        calls.add(call());
        skipWhitespace();
        while (!atEnd()) {
            expect("->");
            skipWhitespace();
            calls.add(call());
            skipWhitespace();
        }
        return new QueryChain(calls);
    }

    // "Member::where(...)" and "->where(...)" are both accepted as "where(...)".
    private void skipPrefix() {
        int mark = pos;
        if (isIdentStart(peek())) {
            identifier();
            skipWhitespace();
            if (lookingAt("::")) {
                pos += 2;
                skipWhitespace();
            } else {
                pos = mark;
            }
        }
        if (lookingAt("->")) {
            pos += 2;
            skipWhitespace();
        }
    }

    private QueryCall call() {
        int start = pos;
        if (!isIdentStart(peek())) {
            throw error("Expected a method name");
        }
        String verb = identifier();
        skipWhitespace();
        expect("(");
        enter();
        List<Object> args = arguments(')');
        leave();
        return new QueryCall(verb, args, start);
    }

    private List<Object> arguments(char close) {
        List<Object> args = new ArrayList<>();
        skipWhitespace();
        if (peek() == close) {
            pos++;
            return args;
        }
        while (true) {
            args.add(argument());
            skipWhitespace();
            if (peek() == ',') {
                pos++;
                skipWhitespace();
            } else if (peek() == close) {
                pos++;
                return args;
            } else if (atEnd()) {
                throw error("Unexpected end of query, expected '" + close + "'");
            } else {
                throw error("Expected ',' or '" + close + "'");
            }
        }
    }

    private Object argument() {
        if (atEnd()) throw error("Unexpected end of query");
        char c = peek();
        if (c == '\'' || c == '"') return string();
        if (c == '-' || isDigit(c)) return number();
        if (c == '[') {
            pos++;
            enter();
            List<Object> items = arguments(']');
            leave();
            return items;
        }
        if (isIdentStart(c)) {
            int start = pos;
            String word = identifier();
            skipWhitespace();
            if (peek() == '(') {
                pos = start;
                return call();
            }
            switch (word.toLowerCase(Locale.ROOT)) {
                case "true":  return Boolean.TRUE;
                case "false": return Boolean.FALSE;
                case "null":  return null;
                default:
                    throw new QuerySyntaxException("'" + word + "' is not a value", start);
            }
        }
        throw error("Unexpected character '" + c + "'");
    }

    // ------------------------------------------------------------------
    // Literals
    // ------------------------------------------------------------------

    private String string() {
        int start = pos;
        char quote = src.charAt(pos++);
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (atEnd()) {
                throw new QuerySyntaxException("Unterminated string", start);
            }
            char c = src.charAt(pos++);
            if (c == quote) return sb.toString();
            if (c == '\\') {
                if (atEnd()) throw new QuerySyntaxException("Unterminated string", start);
                char escaped = src.charAt(pos++);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default  -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }
    }

    private Object number() {
        int start = pos;
        if (peek() == '-') pos++;
        if (!isDigit(peek())) throw error("Expected a digit");
        while (isDigit(peek())) pos++;
        boolean decimal = false;
        if (peek() == '.') {
            decimal = true;
            pos++;
            if (!isDigit(peek())) throw error("Expected a digit after '.'");
            while (isDigit(peek())) pos++;
        }
        if (isIdentPart(peek())) throw error("Malformed number");

        String text = src.substring(start, pos);
        if (!decimal) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return new BigDecimal(text);
            }
        }
        return new BigDecimal(text);
    }

    private String identifier() {
        int start = pos;
        while (isIdentPart(peek())) pos++;
        return src.substring(start, pos);
    }

    // ------------------------------------------------------------------
    // Scanning helpers
    // ------------------------------------------------------------------

    private void enter() {
        if (++depth > MAX_DEPTH) throw error("Query nests deeper than " + MAX_DEPTH + " levels");
    }

    private void leave() {
        depth--;
    }

    private void expect(String token) {
        if (!lookingAt(token)) {
            throw atEnd()
                    ? error("Unexpected end of query, expected '" + token + "'")
                    : error("Expected '" + token + "'");
        }
        pos += token.length();
    }

    private boolean lookingAt(String token) {
        return src.startsWith(token, pos);
    }

    private void skipWhitespace() {
        while (!atEnd()) {
            char c = src.charAt(pos);
            if (c != ' ' && c != '\t' && c != '\r' && c != '\n') return;
            pos++;
        }
    }

    private boolean atEnd() {
        return pos >= src.length();
    }

    private char peek() {
        return atEnd() ? '\0' : src.charAt(pos);
    }

    private QuerySyntaxException error(String message) {
        return new QuerySyntaxException(message, pos);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }
}
