package com.opsdesk.runner.command;

import java.time.Instant;

/**
 * Runtime context passed to every command invocation.
 *
 * Commands use it to print the execution header and to tag log lines
 * with the operator and environment.
 *
 * @param clientAddress remote address of the request, null outside HTTP
 * @param userAgent     client user agent, null outside HTTP
 */
public record CommandExecutionContext(OperatorIdentity operator,
                                      String environment,
                                      Instant startedAt,
                                      String clientAddress,
                                      String userAgent) {

    public CommandExecutionContext(OperatorIdentity operator, String environment, Instant startedAt) {
        this(operator, environment, startedAt, null, null);
    }
}
