package com.opsdesk.runner.command;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of executable commands, keyed by command name.
 *
 * Constructed explicitly by the composition root and handed to every
 * consumer; there is no static access, so tests can build as many isolated
 * registries as they like.
 *
 * <p>Concurrency: registration happens at startup from a single thread and
 * is serialised here anyway; lookups run concurrently afterwards. Every
 * registration publishes a fresh immutable snapshot, so readers never see a
 * half-applied insert.
 *
 * <p>The descriptor checked at registration is the one kept: listing,
 * grouping and metrics tags never ask the command to describe itself again.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Insert-or-reject registration ({@link #register}).</li>
 *   <li>Lookup, listing, grouping and risk filtering.</li>
 *   <li>Metrics-instrumented execution ({@link #execute}) - every call is
 *       timed and counted with no per-command boilerplate.</li>
 * </ol>
 */
public class CommandRegistry {

    private static final Logger log = LoggerFactory.getLogger(CommandRegistry.class);

    /** A command together with the descriptor it was registered under. */
    public record Registration(RunnableCommand command, CommandDescriptor descriptor) {}

    private volatile Map<String, Registration> commands = Map.of();
    private final MeterRegistry meterRegistry;

    public CommandRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    /**
     * Insert a command, or overwrite the one registered under the same name.
     * An overwrite keeps the original position in {@link #all()}.
     *
     * @throws InvalidCommandException if the descriptor is incomplete; the
     *                                 registry is left unchanged
     */
    public synchronized void register(RunnableCommand command) {
        CommandDescriptor d = checkDescriptor(command);

        Map<String, Registration> next = new LinkedHashMap<>(commands);
        Registration previous = next.put(d.name(), new Registration(command, d));
        commands = Collections.unmodifiableMap(next);

        if (previous != null && previous.command() != command) {
            log.info("Re-registered command '{}' ({} replaces {})",
                    d.name(), command.getClass().getSimpleName(), previous.command().getClass().getSimpleName());
        } else {
            log.info("Registered command '{}' [{}] in '{}'", d.name(), d.riskLevel(), d.category());
        }
    }

    /**
     * Register each command in turn. A rejected command is logged and skipped;
     * it never affects the others.
     *
     * @return names (or class names, when the name is unusable) of the rejected commands
     */
    public List<String> registerMany(List<? extends RunnableCommand> candidates) {
        List<String> rejected = new ArrayList<>();
        for (RunnableCommand candidate : candidates) {
            try {
                register(candidate);
            } catch (InvalidCommandException e) {
                String id = identify(candidate);
                log.warn("Skipping command {}: {}", id, e.getDetail());
                rejected.add(id);
            }
        }
        return rejected;
    }

    private static String identify(RunnableCommand candidate) {
        if (candidate == null) return "null";
        try {
            CommandDescriptor d = candidate.descriptor();
            if (d != null && d.name() != null && !d.name().isBlank()) return d.name();
        } catch (RuntimeException e) {
            log.debug("Descriptor of {} is unreadable", candidate.getClass().getName(), e);
        }
        return candidate.getClass().getName();
    }

    private static CommandDescriptor checkDescriptor(RunnableCommand command) {
        if (command == null) {
            throw new InvalidCommandException("Command must not be null");
        }
        CommandDescriptor d;
        try {
            d = command.descriptor();
        } catch (RuntimeException e) {
            throw new InvalidCommandException(
                    command.getClass().getName() + " failed to describe itself: " + e.getMessage(), e);
        }
        if (d == null) {
            throw new InvalidCommandException(command.getClass().getName() + " has no descriptor");
        }
        requireText(d.name(), "name", command);
        requireText(d.displayName(), "display name", command);
        requireText(d.category(), "category", command);
        if (d.description() == null) {
            throw new InvalidCommandException(command.getClass().getName() + " has no description");
        }
        if (d.riskLevel() == null) {
            throw new InvalidCommandException("Command '" + d.name() + "' has no risk level");
        }
        if (d.options().containsKey(null) || d.options().containsValue(null)) {
            throw new InvalidCommandException("Command '" + d.name() + "' has an incomplete option schema");
        }
        return d;
    }

    private static void requireText(String value, String what, RunnableCommand command) {
        if (value == null || value.isBlank()) {
            throw new InvalidCommandException(command.getClass().getName() + " has no " + what);
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Optional<RunnableCommand> get(String name) {
        return registration(name).map(Registration::command);
    }

    /** The descriptor captured when {@code name} was registered. */
    public Optional<CommandDescriptor> descriptor(String name) {
        return registration(name).map(Registration::descriptor);
    }

    public Optional<Registration> registration(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(commands.get(name));
    }

    /** Like {@link #get} but fails for an unknown name. */
    public RunnableCommand require(String name) {
        return get(name).orElseThrow(() -> new CommandNotFoundException(name));
    }

    public boolean has(String name) {
        return name != null && commands.containsKey(name);
    }

    /** Snapshot in registration order. */
    public List<RunnableCommand> all() {
        return commands.values().stream().map(Registration::command).toList();
    }

    /** Snapshot of commands with their descriptors, in registration order. */
    public List<Registration> registrations() {
        return List.copyOf(commands.values());
    }

    /** Registered command names, in registration order. */
    public List<String> names() {
        return List.copyOf(commands.keySet());
    }

    /** Category → commands; categories and their members keep registration order. */
    public Map<String, List<RunnableCommand>> groupByCategory() {
        Map<String, List<RunnableCommand>> grouped = new LinkedHashMap<>();
        for (Registration r : commands.values()) {
            grouped.computeIfAbsent(r.descriptor().category(), k -> new ArrayList<>()).add(r.command());
        }
        grouped.replaceAll((k, v) -> List.copyOf(v));
        return Collections.unmodifiableMap(grouped);
    }

    public List<RunnableCommand> filterByRisk(RiskLevel level) {
        return commands.values().stream()
                .filter(r -> r.descriptor().riskLevel() == level)
                .map(Registration::command)
                .toList();
    }

    public List<RunnableCommand> requiringConfirmation() {
        return commands.values().stream()
                .filter(r -> r.descriptor().requiresConfirmation())
                .map(Registration::command)
                .toList();
    }

    /** Drop every entry. Debug and test use only. */
    synchronized void reset() {
        commands = Map.of();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Execute a named command with timing and counting:
     * <pre>
     *   opsdesk.command.calls{command, status="success|failed|rule_violation|..."}
     *   opsdesk.command.duration{command, risk="low|medium|high"}
     * </pre>
     * The caller is responsible for validation and policy checks; this method
     * only runs and measures.
     *
     * @throws CommandException     when the command refuses the request
     * @throws CommandNotFoundException for an unknown name
     */
    public CommandResult execute(String name, Map<String, Object> options, CommandExecutionContext ctx) {
        Registration registration = registration(name).orElseThrow(() -> new CommandNotFoundException(name));
        RunnableCommand command = registration.command();
        String riskTag = registration.descriptor().riskLevel().name().toLowerCase(Locale.ROOT);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            CommandResult result = command.execute(options, ctx);
            if (!result.success()) status = "failed";
            return result;
        } catch (CommandException e) {
            status = e.getKind().name().toLowerCase(Locale.ROOT);
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            throw new CommandException(CommandException.Kind.EXECUTION_ERROR,
                    "Unexpected error in command '" + name + "': " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("opsdesk.command.duration",
                    "command", name, "risk", riskTag));
            meterRegistry.counter("opsdesk.command.calls",
                    "command", name, "status", status).increment();
        }
    }
}
