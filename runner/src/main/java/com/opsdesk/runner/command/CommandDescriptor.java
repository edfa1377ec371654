package com.opsdesk.runner.command;

import com.opsdesk.runner.command.option.OptionSpec;
import com.opsdesk.runner.policy.ConfirmationPolicy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identity and metadata of one executable command.
 *
 * @param name                 unique registry key, e.g. "entity:query"
 * @param displayName          operator-facing name
 * @param description          one-sentence summary shown in the catalog
 * @param category             catalog grouping, e.g. "Data Exploration"
 * @param riskLevel            drives confirmation and environment gating
 * @param explicitConfirmation author-declared confirmation, on top of the risk rule
 * @param options              option key → spec; iteration order is rendering order.
 *                             Copied on construction and never mutated afterwards.
 */
public record CommandDescriptor(
        String                  name,
        String                  displayName,
        String                  description,
        String                  category,
        RiskLevel               riskLevel,
        boolean                 explicitConfirmation,
        Map<String, OptionSpec> options) {

    public CommandDescriptor {
        options = Collections.unmodifiableMap(
                options == null ? new LinkedHashMap<>() : new LinkedHashMap<>(options));
    }

    /** Medium and high risk always need confirmation; low risk only when declared. */
    public boolean requiresConfirmation() {
        return ConfirmationPolicy.requiresConfirmation(riskLevel, explicitConfirmation);
    }
}
