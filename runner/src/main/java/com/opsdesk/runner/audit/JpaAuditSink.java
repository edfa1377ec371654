package com.opsdesk.runner.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdesk.runner.config.RunnerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Stores execution records in the command_executions table.
 * Disabled by {@code opsdesk.runner.log-executions: false}.
 */
@Component
public class JpaAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(JpaAuditSink.class);

    private static final int MAX_USER_AGENT = 255;
    private static final int MAX_ADDRESS = 45;

    private final CommandExecutionRepository executions;
    private final ObjectMapper objectMapper;
    private final RunnerProperties properties;

    public JpaAuditSink(CommandExecutionRepository executions, ObjectMapper objectMapper,
                        RunnerProperties properties) {
        this.executions = executions;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void record(ExecutionAudit audit) {
        if (!properties.isLogExecutions()) return;

        CommandExecution row = new CommandExecution(audit.command(), audit.environment(), audit.startedAt());
        row.setOptions(toJson(audit));
        if (audit.operator() != null) {
            row.setUserId(audit.operator().id());
            row.setUserName(audit.operator().name());
            row.setUserEmail(audit.operator().email());
        }
        row.setExitCode(audit.exitCode());
        row.setOutput(audit.output());
        row.setExecutionTime(audit.elapsedSeconds());
        row.setCompletedAt(audit.completedAt());
        row.setIpAddress(truncate(audit.clientAddress(), MAX_ADDRESS));
        row.setUserAgent(truncate(audit.userAgent(), MAX_USER_AGENT));

        try {
            executions.save(row);
            log.debug("Audited {} (exit {})", audit.command(), audit.exitCode());
        } catch (DataAccessException e) {
            log.error("Failed to write audit record for {}: {}", audit.command(), e.getMessage(), e);
        }
    }

    private String toJson(ExecutionAudit audit) {
        if (audit.options() == null || audit.options().isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(audit.options());
        } catch (JsonProcessingException e) {
            log.warn("Options of {} are not serializable, storing keys only: {}", audit.command(), e.getOriginalMessage());
            return audit.options().keySet().toString();
        }
    }

    private static String truncate(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }
}
