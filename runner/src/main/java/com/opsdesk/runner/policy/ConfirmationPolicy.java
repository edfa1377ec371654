package com.opsdesk.runner.policy;

import com.opsdesk.runner.command.RiskLevel;

/**
 * Risk → confirmation rule.
 *
 * Pure function, no configuration: anything above LOW risk needs an explicit
 * operator confirmation, LOW risk only when the command author asked for it.
 */
public final class ConfirmationPolicy {

    private ConfirmationPolicy() {}

    public static boolean requiresConfirmation(RiskLevel risk, boolean explicitConfirmation) {
        return explicitConfirmation || risk != RiskLevel.LOW;
    }
}
