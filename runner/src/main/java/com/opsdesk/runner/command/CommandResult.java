package com.opsdesk.runner.command;

/**
 * What a command hands back to the caller: the rendered output text, an
 * exit code (0 = success) and the wall-clock time it took.
 */
public record CommandResult(String output, int exitCode, double elapsedSeconds) {

    public boolean success() {
        return exitCode == 0;
    }
}
