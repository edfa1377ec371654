package com.opsdesk.runner.service;

import com.opsdesk.runner.audit.AuditSink;
import com.opsdesk.runner.audit.CommandExecution;
import com.opsdesk.runner.audit.CommandExecutionRepository;
import com.opsdesk.runner.audit.ExecutionAudit;
import com.opsdesk.runner.command.CommandDescriptor;
import com.opsdesk.runner.command.CommandException;
import com.opsdesk.runner.command.CommandExecutionContext;
import com.opsdesk.runner.command.CommandNotFoundException;
import com.opsdesk.runner.command.CommandRegistry;
import com.opsdesk.runner.command.CommandResult;
import com.opsdesk.runner.command.OperatorIdentity;
import com.opsdesk.runner.command.RunnableCommand;
import com.opsdesk.runner.command.option.OptionSpec;
import com.opsdesk.runner.config.RunnerProperties;
import com.opsdesk.runner.policy.Availability;
import com.opsdesk.runner.policy.EnvironmentPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller-facing orchestration of one execution request.
 *
 * Order of checks, all evaluated fresh per request:
 * <ol>
 *   <li>lookup by name</li>
 *   <li>environment gate: DISABLED commands are refused outright</li>
 *   <li>confirmation: risk rule, RESTRICTED availability, production switch</li>
 *   <li>option defaults, then the command's own validation</li>
 *   <li>timed execution through the registry</li>
 * </ol>
 * Steps 1 to 3 throw. Validation and execution failures are turned into a
 * report with exit code 1 and, like successful runs, sent to the audit sink.
 */
@Service
public class CommandRunnerService {

    private static final Logger log = LoggerFactory.getLogger(CommandRunnerService.class);

    static final int MAX_RECENT = 200;

    /**
     * @param confirmed     the operator explicitly confirmed this run
     * @param clientAddress remote address, may be null
     * @param userAgent     client user agent, may be null
     */
    public record ExecutionRequest(String command,
                                   Map<String, Object> options,
                                   boolean confirmed,
                                   OperatorIdentity operator,
                                   String clientAddress,
                                   String userAgent) {}

    /**
     * @param errorKind null on success; the failure category otherwise
     */
    public record ExecutionReport(String command,
                                  String output,
                                  int exitCode,
                                  double elapsedSeconds,
                                  CommandException.Kind errorKind) {}

    private final CommandRegistry registry;
    private final EnvironmentPolicy policy;
    private final AuditSink auditSink;
    private final CommandExecutionRepository executions;
    private final RunnerProperties properties;
    private final Clock clock;

    public CommandRunnerService(CommandRegistry registry,
                                EnvironmentPolicy policy,
                                AuditSink auditSink,
                                CommandExecutionRepository executions,
                                RunnerProperties properties,
                                Clock clock) {
        this.registry   = registry;
        this.policy     = policy;
        this.auditSink  = auditSink;
        this.executions = executions;
        this.properties = properties;
        this.clock      = clock;
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public String environment() {
        return properties.getEnvironment();
    }

    /**
     * @throws CommandNotFoundException for an unknown name
     * @throws CommandException COMMAND_RESTRICTED or CONFIRMATION_REQUIRED when the
     *                          policy refuses the request; nothing is executed
     */
    public ExecutionReport execute(ExecutionRequest request) {
        CommandRegistry.Registration registration = registry.registration(request.command())
                .orElseThrow(() -> new CommandNotFoundException(request.command()));
        RunnableCommand command = registration.command();
        CommandDescriptor descriptor = registration.descriptor();
        String environment = properties.getEnvironment();

        Availability availability = policy.availability(descriptor, environment);
        if (availability == Availability.DISABLED) {
            log.warn("Refused {} in {}: risk {} is not allowed", descriptor.name(), environment, descriptor.riskLevel());
            throw new CommandException(CommandException.Kind.COMMAND_RESTRICTED,
                    "Command '" + descriptor.name() + "' is not available in the " + environment + " environment");
        }
        if (policy.requiresConfirmation(descriptor, environment) && !request.confirmed()) {
            throw new CommandException(CommandException.Kind.CONFIRMATION_REQUIRED,
                    "Command '" + descriptor.name() + "' requires explicit confirmation");
        }

        Map<String, Object> options = withDefaults(request.options(), descriptor.options());
        OperatorIdentity operator = request.operator() != null ? request.operator() : OperatorIdentity.ANONYMOUS;
        Instant startedAt = Instant.now(clock);
        CommandExecutionContext ctx = new CommandExecutionContext(
                operator, environment, startedAt, request.clientAddress(), request.userAgent());

        log.info("Executing {} for {} in {}", descriptor.name(), operator.name(), environment);

        ExecutionReport report;
        long start = System.nanoTime();
        try {
            command.validate(options);
            CommandResult result = registry.execute(descriptor.name(), options, ctx);
            report = new ExecutionReport(descriptor.name(), result.output(), result.exitCode(),
                    result.elapsedSeconds(), result.success() ? null : CommandException.Kind.EXECUTION_ERROR);
        } catch (CommandException e) {
            double elapsed = Math.round((System.nanoTime() - start) / 1_000_000.0) / 1000.0;
            log.warn("{} failed after {}s: {}", descriptor.name(), elapsed, e.getMessage());
            report = new ExecutionReport(descriptor.name(), "Error: " + e.getDetail() + "\n", 1, elapsed, e.getKind());
        }

        auditSink.record(new ExecutionAudit(descriptor.name(), options, operator, report.exitCode(),
                report.output(), report.elapsedSeconds(), environment, startedAt, Instant.now(clock),
                request.clientAddress(), request.userAgent()));
        return report;
    }

    /** Most recent audit rows, newest first. */
    public List<CommandExecution> recentExecutions(int limit) {
        int size = Math.max(1, Math.min(limit, MAX_RECENT));
        return executions.findAllByOrderByStartedAtDesc(PageRequest.of(0, size));
    }

    /** Fills absent or null options from the schema defaults. */
    static Map<String, Object> withDefaults(Map<String, Object> submitted, Map<String, OptionSpec> schema) {
        Map<String, Object> options = new LinkedHashMap<>();
        if (submitted != null) options.putAll(submitted);
        schema.forEach((key, spec) -> {
            if (options.get(key) == null && spec.defaultValue() != null) {
                options.put(key, spec.defaultValue());
            }
        });
        return options;
    }
}
