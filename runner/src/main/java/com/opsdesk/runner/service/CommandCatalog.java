package com.opsdesk.runner.service;

import com.opsdesk.runner.command.CommandDescriptor;
import com.opsdesk.runner.command.CommandNotFoundException;
import com.opsdesk.runner.command.CommandRegistry;
import com.opsdesk.runner.config.CommandDiscovery;
import com.opsdesk.runner.config.RunnerProperties;
import com.opsdesk.runner.policy.Availability;
import com.opsdesk.runner.policy.EnvironmentPolicy;
import com.opsdesk.runner.query.EntityTypeInfo;
import com.opsdesk.runner.query.EntityTypeResolver;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side of the runner: what an operator may see in the current
 * environment.
 *
 * DISABLED commands never appear. RESTRICTED commands appear only in the
 * full listing, flagged, and never in the eligible one.
 */
@Service
public class CommandCatalog {

    public record Entry(CommandDescriptor descriptor, Availability availability, boolean confirmationRequired) {}

    private final CommandRegistry registry;
    private final EnvironmentPolicy policy;
    private final RunnerProperties properties;
    private final CommandDiscovery discovery;
    private final EntityTypeResolver entityTypes;

    public CommandCatalog(CommandRegistry registry,
                          EnvironmentPolicy policy,
                          RunnerProperties properties,
                          CommandDiscovery discovery,
                          EntityTypeResolver entityTypes) {
        this.registry    = registry;
        this.policy      = policy;
        this.properties  = properties;
        this.discovery   = discovery;
        this.entityTypes = entityTypes;
    }

    /**
     * @param eligibleOnly leave out RESTRICTED commands as well
     */
    public Map<String, List<Entry>> byCategory(boolean eligibleOnly) {
        String environment = properties.getEnvironment();
        Map<String, List<Entry>> grouped = new LinkedHashMap<>();
        for (CommandRegistry.Registration registration : registry.registrations()) {
            CommandDescriptor d = registration.descriptor();
            Availability availability = policy.availability(d, environment);
            if (availability == Availability.DISABLED) continue;
            if (eligibleOnly && !availability.eligible()) continue;
            grouped.computeIfAbsent(d.category(), k -> new ArrayList<>())
                    .add(new Entry(d, availability, policy.requiresConfirmation(d, environment)));
        }
        return grouped;
    }

    /** @throws CommandNotFoundException for unknown and DISABLED commands alike */
    public Entry describe(String name) {
        CommandDescriptor d = registry.descriptor(name).orElseThrow(() -> new CommandNotFoundException(name));
        String environment = properties.getEnvironment();
        Availability availability = policy.availability(d, environment);
        if (availability == Availability.DISABLED) {
            throw new CommandNotFoundException(name);
        }
        return new Entry(d, availability, policy.requiresConfirmation(d, environment));
    }

    /** Discovered command classes that were not registered. */
    public List<String> discovered() {
        return discovery.unregistered();
    }

    public List<EntityTypeInfo> entityTypes() {
        return entityTypes.entityTypes();
    }

    public String environment() {
        return properties.getEnvironment();
    }
}
