package com.opsdesk.runner.audit;

import com.opsdesk.runner.command.OperatorIdentity;

import java.time.Instant;
import java.util.Map;

/**
 * Everything recorded about one execution attempt, successful or not.
 */
public record ExecutionAudit(
        String command,
        Map<String, Object> options,
        OperatorIdentity operator,
        int exitCode,
        String output,
        double elapsedSeconds,
        String environment,
        Instant startedAt,
        Instant completedAt,
        String clientAddress,
        String userAgent
) {}
