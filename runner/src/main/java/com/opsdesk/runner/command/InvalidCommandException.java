package com.opsdesk.runner.command;

/**
 * Registration-time rejection: the candidate does not carry the metadata
 * every command must expose. The registry is left untouched.
 */
public class InvalidCommandException extends CommandException {

    public InvalidCommandException(String message) {
        super(Kind.INVALID_COMMAND, message);
    }

    public InvalidCommandException(String message, Throwable cause) {
        super(Kind.INVALID_COMMAND, message, cause);
    }
}
