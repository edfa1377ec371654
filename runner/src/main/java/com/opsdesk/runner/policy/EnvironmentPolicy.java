package com.opsdesk.runner.policy;

import com.opsdesk.runner.command.CommandDescriptor;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Environment eligibility for commands.
 *
 * Deterministic and uncached: every call evaluates the descriptor against the
 * restriction configured for the given environment. Environments without a
 * restriction allow everything. Environment names compare case-insensitively.
 * A comma-separated name (an active-profile list, say) is checked name by
 * name and the strictest result wins.
 */
public class EnvironmentPolicy {

    public static final String PRODUCTION = "production";

    private final Map<String, EnvironmentRestriction> restrictions;
    private final boolean confirmAllInProduction;

    public EnvironmentPolicy(Map<String, EnvironmentRestriction> restrictions, boolean confirmAllInProduction) {
        Map<String, EnvironmentRestriction> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (restrictions != null) copy.putAll(restrictions);
        this.restrictions = copy;
        this.confirmAllInProduction = confirmAllInProduction;
    }

    public Availability availability(CommandDescriptor command, String environment) {
        Availability strictest = Availability.AVAILABLE;
        for (String name : names(environment)) {
            Availability a = availabilityIn(command, restrictions.get(name));
            if (a.compareTo(strictest) > 0) strictest = a;
        }
        return strictest;
    }

    private static Availability availabilityIn(CommandDescriptor command, EnvironmentRestriction restriction) {
        if (restriction == null || restriction.allows(command.riskLevel())) {
            return Availability.AVAILABLE;
        }
        return restriction.disableUnlessConfirmed() ? Availability.DISABLED : Availability.RESTRICTED;
    }

    static List<String> names(String environment) {
        if (environment == null) return List.of();
        return Arrays.stream(environment.split(","))
                .map(String::trim)
                .filter(n -> !n.isEmpty())
                .toList();
    }

    public boolean isEligible(CommandDescriptor command, String environment) {
        return availability(command, environment).eligible();
    }

    /**
     * Whether running {@code command} in {@code environment} needs an explicit
     * confirmation: the risk rule, a RESTRICTED availability, or the
     * production-wide switch.
     */
    public boolean requiresConfirmation(CommandDescriptor command, String environment) {
        if (command.requiresConfirmation()) return true;
        if (availability(command, environment) == Availability.RESTRICTED) return true;
        return confirmAllInProduction
                && names(environment).stream().anyMatch(PRODUCTION::equalsIgnoreCase);
    }
}
