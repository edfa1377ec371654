package com.opsdesk.runner.api.dto;

import com.opsdesk.runner.service.CommandRunnerService.ExecutionReport;

/**
 * Response body for POST /commands/{name}/executions.
 * errorKind is null when the run succeeded.
 */
public record ExecutionResponse(
        String command,
        String output,
        int    exitCode,
        double elapsedSeconds,
        String errorKind
) {
    public static ExecutionResponse from(ExecutionReport report) {
        return new ExecutionResponse(
                report.command(),
                report.output(),
                report.exitCode(),
                report.elapsedSeconds(),
                report.errorKind() == null ? null : report.errorKind().name()
        );
    }
}
