package com.opsdesk.runner.command;

public class CommandNotFoundException extends RuntimeException {
    public CommandNotFoundException(String name) {
        super("No command registered with name: '" + name + "'");
    }
}
