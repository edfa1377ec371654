package com.opsdesk.runner.query;

/**
 * The expression does not follow the query grammar. Never recovered from:
 * an expression that cannot be parsed is rejected.
 */
public class QuerySyntaxException extends RuntimeException {

    private final int position;

    public QuerySyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() { return position; }
}
