package com.opsdesk.runner.api.dto;

import com.opsdesk.runner.audit.CommandExecution;

import java.time.Instant;

/**
 * One audit row in GET /executions. Output is omitted; options are the
 * stored JSON text.
 */
public record ExecutionLogResponse(
        Long    id,
        String  command,
        String  options,
        String  userName,
        Integer exitCode,
        Double  executionTime,
        String  environment,
        Instant startedAt,
        Instant completedAt
) {
    public static ExecutionLogResponse from(CommandExecution e) {
        return new ExecutionLogResponse(
                e.getId(),
                e.getCommand(),
                e.getOptions(),
                e.getUserName(),
                e.getExitCode(),
                e.getExecutionTime(),
                e.getEnvironment(),
                e.getStartedAt(),
                e.getCompletedAt()
        );
    }
}
