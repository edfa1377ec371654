package com.opsdesk.runner.command.impl;

import com.opsdesk.runner.audit.CommandExecutionRepository;
import com.opsdesk.runner.command.AbstractCommand;
import com.opsdesk.runner.command.CommandDescriptor;
import com.opsdesk.runner.command.CommandException;
import com.opsdesk.runner.command.CommandExecutionContext;
import com.opsdesk.runner.command.CommandResult;
import com.opsdesk.runner.command.RiskLevel;
import com.opsdesk.runner.command.option.OptionSpec;
import com.opsdesk.runner.command.option.OptionValidator;
import com.opsdesk.runner.support.OutputFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * db:cleanup - removes stale rows from maintenance tables, with a dry run
 * that only counts them.
 */
public class DatabaseCleanupCommand extends AbstractCommand {

    private static final Logger log = LoggerFactory.getLogger(DatabaseCleanupCommand.class);

    public static final String NAME = "db:cleanup";
    public static final String OPT_TABLES = "tables";
    public static final String OPT_DAYS = "days";
    public static final String OPT_DRY_RUN = "dry_run";

    static final String EXECUTIONS_TABLE = "command_executions";
    private static final int DEFAULT_DAYS = 30;

    private final CommandExecutionRepository executions;
    private final TransactionTemplate tx;
    private final Clock clock;

    public DatabaseCleanupCommand(CommandExecutionRepository executions,
                                  PlatformTransactionManager transactionManager,
                                  Clock clock) {
        super(describe());
        this.executions = executions;
        this.tx = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    private static CommandDescriptor describe() {
        Map<String, OptionSpec> options = new LinkedHashMap<>();
        options.put(OPT_TABLES, OptionSpec.choice("Tables to Clean")
                .required()
                .choice(EXECUTIONS_TABLE, "Command Execution Log")
                .help("Select which table to clean up")
                .build());
        options.put(OPT_DAYS, OptionSpec.text("Keep Records Newer Than (Days)")
                .defaultValue(String.valueOf(DEFAULT_DAYS))
                .numeric()
                .rules("integer|min:1|max:365")
                .help("Records older than this will be deleted")
                .build());
        options.put(OPT_DRY_RUN, OptionSpec.bool("Dry Run (Preview Only)")
                .defaultValue(Boolean.TRUE)
                .help("Show what would be deleted without making changes")
                .build());
        return new CommandDescriptor(NAME, "Database Cleanup", "Remove stale records from the database",
                "Database Maintenance", RiskLevel.MEDIUM, true, options);
    }

    @Override
    public void validate(Map<String, Object> options) {
        super.validate(options);

        Object table = options.get(OPT_TABLES);
        if (!descriptor().options().get(OPT_TABLES).resolvedChoices().containsKey(String.valueOf(table))) {
            throw new CommandException(CommandException.Kind.RULE_VIOLATION,
                    "Table '" + table + "' cannot be cleaned by this command");
        }
    }

    @Override
    public CommandResult execute(Map<String, Object> options, CommandExecutionContext ctx) {
        validate(options);

        String table = String.valueOf(options.get(OPT_TABLES));
        int days = OptionValidator.asNumber(options.get(OPT_DAYS))
                .map(BigDecimal::intValue)
                .orElse(DEFAULT_DAYS);
        boolean dryRun = isDryRun(options.get(OPT_DRY_RUN));

        Map<String, Object> shown = new LinkedHashMap<>();
        shown.put(OPT_TABLES, table);
        shown.put(OPT_DAYS, days);
        shown.put(OPT_DRY_RUN, dryRun ? "Yes" : "No");

        StringBuilder out = new StringBuilder(OutputFormatter.executionHeader(NAME, ctx.operator().name(),
                ctx.startedAt().atZone(clock.getZone()), ctx.environment(), shown));
        out.append("Database Cleanup: ").append(table).append('\n');
        if (dryRun) {
            out.append("DRY RUN - No records will be deleted\n\n");
        }
        out.append("Scanning ").append(table).append(" for records older than ").append(days).append(" days...\n");

        long start = System.nanoTime();
        Instant cutoff = Instant.now(clock).minus(Duration.ofDays(days));
        try {
            long found = executions.countByCreatedAtBefore(cutoff);
            out.append("Found ").append(found).append(" records matching criteria\n");

            if (dryRun) {
                out.append("Would delete: ").append(found).append(" records\n");
            } else {
                Integer deleted = tx.execute(status -> executions.deleteCreatedBefore(cutoff));
                log.info("db:cleanup removed {} rows from {} (older than {} days) for {}",
                        deleted, table, days, ctx.operator().name());
                out.append("Deleted: ").append(deleted).append(" records\n");
            }

            double elapsed = elapsedSince(start);
            out.append(OutputFormatter.executionFooter(Instant.now(clock).atZone(clock.getZone()), elapsed, 0, null));
            return new CommandResult(out.toString(), 0, elapsed);

        } catch (DataAccessException e) {
            double elapsed = elapsedSince(start);
            log.warn("db:cleanup on {} failed after {}s: {}", table, elapsed, e.getMessage());
            out.append(OutputFormatter.executionFooter(Instant.now(clock).atZone(clock.getZone()),
                    elapsed, 1, e.getMostSpecificCause().getMessage()));
            return new CommandResult(out.toString(), 1, elapsed);
        }
    }

    private static boolean isDryRun(Object value) {
        if (value == null) return true;
        if (value instanceof Boolean b) return b;
        String text = String.valueOf(value).strip();
        return !(text.equalsIgnoreCase("false") || text.equals("0") || text.equalsIgnoreCase("no"));
    }

    private static double elapsedSince(long startNanos) {
        return Math.round((System.nanoTime() - startNanos) / 1_000_000.0) / 1000.0;
    }
}
