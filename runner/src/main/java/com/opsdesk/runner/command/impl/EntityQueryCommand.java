package com.opsdesk.runner.command.impl;

import com.opsdesk.runner.command.AbstractCommand;
import com.opsdesk.runner.command.CommandDescriptor;
import com.opsdesk.runner.command.CommandException;
import com.opsdesk.runner.command.CommandExecutionContext;
import com.opsdesk.runner.command.CommandResult;
import com.opsdesk.runner.command.RiskLevel;
import com.opsdesk.runner.command.option.OptionSpec;
import com.opsdesk.runner.query.EntityTypeInfo;
import com.opsdesk.runner.query.EntityTypeResolver;
import com.opsdesk.runner.query.ExecutionOutcome;
import com.opsdesk.runner.query.QueryExecutor;
import com.opsdesk.runner.query.QueryValidator;
import com.opsdesk.runner.query.ResultFormatter;
import com.opsdesk.runner.support.OutputFormatter;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * entity:query - read-only data exploration over any mapped entity.
 *
 * The query text goes through the sandboxed validator twice: once in
 * {@link #validate} and again inside {@link QueryExecutor#run} right before
 * evaluation.
 */
public class EntityQueryCommand extends AbstractCommand {

    public static final String NAME = "entity:query";
    public static final String OPT_ENTITY = "entity";
    public static final String OPT_QUERY = "query";

    private static final String RULE = "─".repeat(OutputFormatter.WIDTH);

    private final EntityTypeResolver entityTypes;
    private final QueryExecutor executor;
    private final ResultFormatter formatter;
    private final Clock clock;

    public EntityQueryCommand(EntityTypeResolver entityTypes, QueryExecutor executor,
                              ResultFormatter formatter, Clock clock) {
        super(describe(entityTypes));
        this.entityTypes = entityTypes;
        this.executor = executor;
        this.formatter = formatter;
        this.clock = clock;
    }

    private static CommandDescriptor describe(EntityTypeResolver entityTypes) {
        Map<String, OptionSpec> options = new LinkedHashMap<>();
        options.put(OPT_ENTITY, OptionSpec.choice("Entity")
                .required()
                .choices(entityTypes::choices)
                .help("Select the entity type to query")
                .build());
        options.put(OPT_QUERY, OptionSpec.longText("Query")
                .required()
                .placeholder("whereDate('createdAt', today())->get()->pluck('name', 'id')")
                .help("Query method chain without the entity name, e.g. where('status', 'ACTIVE')->latest()->take(10)->get()")
                .build());
        return new CommandDescriptor(NAME, "Entity Query Runner",
                "Run read-only queries for data exploration. Only SELECT-type queries are allowed.",
                "Data Exploration", RiskLevel.LOW, false, options);
    }

    @Override
    public void validate(Map<String, Object> options) {
        super.validate(options);

        String entity = String.valueOf(options.get(OPT_ENTITY));
        if (entityTypes.resolve(entity).isEmpty()) {
            throw new CommandException(CommandException.Kind.UNKNOWN_ENTITY_TYPE,
                    "Entity type '" + entity + "' does not exist");
        }
        QueryValidator.validate(String.valueOf(options.get(OPT_QUERY)));
    }

    @Override
    public CommandResult execute(Map<String, Object> options, CommandExecutionContext ctx) {
        validate(options);

        String entity = String.valueOf(options.get(OPT_ENTITY));
        String query = String.valueOf(options.get(OPT_QUERY)).strip();
        String entityName = entityTypes.resolve(entity).map(EntityTypeInfo::name).orElse(entity);

        Map<String, Object> shown = new LinkedHashMap<>();
        shown.put(OPT_ENTITY, entity);
        shown.put(OPT_QUERY, query);

        StringBuilder out = new StringBuilder(OutputFormatter.executionHeader(NAME, ctx.operator().name(),
                ctx.startedAt().atZone(clock.getZone()), ctx.environment(), shown));
        out.append("Entity: ").append(entity).append('\n');
        out.append("Query: ").append(query).append("\n\n");
        out.append("Executing: ").append(entityName).append("::").append(query).append('\n');
        out.append(RULE).append("\n\n");

        ExecutionOutcome outcome = executor.run(entity, query);
        Instant completedAt = Instant.now(clock);

        if (outcome.success()) {
            out.append("Query executed successfully\n\n");
            out.append("Results:\n").append(RULE).append('\n');
            out.append(formatter.format(outcome.value())).append('\n');
            out.append(OutputFormatter.executionFooter(completedAt.atZone(clock.getZone()),
                    outcome.elapsedSeconds(), 0, null));
        } else {
            out.append(OutputFormatter.executionFooter(completedAt.atZone(clock.getZone()),
                    outcome.elapsedSeconds(), 1, outcome.errorMessage()));
        }
        return new CommandResult(out.toString(), outcome.exitCode(), outcome.elapsedSeconds());
    }
}
