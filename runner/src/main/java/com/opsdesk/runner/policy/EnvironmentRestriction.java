package com.opsdesk.runner.policy;

import com.opsdesk.runner.command.RiskLevel;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-environment gate.
 *
 * @param allowedRiskLevels      risk levels that may run in the environment
 * @param disableUnlessConfirmed commands outside the allowed set are disabled
 *                               instead of merely requiring confirmation
 */
public record EnvironmentRestriction(Set<RiskLevel> allowedRiskLevels, boolean disableUnlessConfirmed) {

    public EnvironmentRestriction {
        allowedRiskLevels = allowedRiskLevels == null || allowedRiskLevels.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(allowedRiskLevels));
    }

    public boolean allows(RiskLevel risk) {
        return allowedRiskLevels.contains(risk);
    }
}
