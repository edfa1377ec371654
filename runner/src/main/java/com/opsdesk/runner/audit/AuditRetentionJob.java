package com.opsdesk.runner.audit;

import com.opsdesk.runner.config.RunnerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Purges audit rows older than {@code opsdesk.runner.audit.keep-logs-for-days}.
 * A non-positive setting keeps everything.
 */
@Component
public class AuditRetentionJob {

    private static final Logger log = LoggerFactory.getLogger(AuditRetentionJob.class);

    private final CommandExecutionRepository executions;
    private final RunnerProperties properties;
    private final Clock clock;

    public AuditRetentionJob(CommandExecutionRepository executions, RunnerProperties properties, Clock clock) {
        this.executions = executions;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${opsdesk.runner.audit.purge-cron:0 30 3 * * *}")
    @Transactional
    public int purge() {
        int days = properties.getAudit().getKeepLogsForDays();
        if (days <= 0) return 0;

        Instant cutoff = Instant.now(clock).minus(Duration.ofDays(days));
        int removed = executions.deleteCreatedBefore(cutoff);
        if (removed > 0) {
            log.info("Purged {} audit records older than {} days", removed, days);
        }
        return removed;
    }
}
