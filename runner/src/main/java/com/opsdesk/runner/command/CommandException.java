package com.opsdesk.runner.command;

/**
 * Thrown when a request for a command must be refused: bad options, a
 * rejected query, an environment restriction, a missing confirmation, or a
 * failure at the evaluation boundary.
 *
 * Unchecked so callers only catch it at the request boundary. Every kind is
 * recoverable there: the request ends with a user-visible message and the
 * process keeps running.
 */
public class CommandException extends RuntimeException {

    public enum Kind {
        MISSING_REQUIRED,
        RULE_VIOLATION,
        INVALID_COMMAND,
        DISALLOWED_PATTERN,
        DISALLOWED_VERB,
        PARSE_ERROR,
        UNKNOWN_ENTITY_TYPE,
        EXECUTION_ERROR,
        CONFIRMATION_REQUIRED,
        COMMAND_RESTRICTED
    }

    private final Kind kind;
    private final String detail;

    public CommandException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
        this.detail = message;
    }

    public CommandException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
        this.detail = message;
    }

    public Kind getKind() { return kind; }

    /** The message without the kind prefix, suitable for an operator. */
    public String getDetail() { return detail; }
}
