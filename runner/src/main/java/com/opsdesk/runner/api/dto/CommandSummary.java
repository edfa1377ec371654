package com.opsdesk.runner.api.dto;

import com.opsdesk.runner.command.CommandDescriptor;
import com.opsdesk.runner.service.CommandCatalog;

/**
 * One catalog entry in GET /commands.
 */
public record CommandSummary(
        String  name,
        String  displayName,
        String  description,
        String  category,
        String  riskLevel,
        String  availability,
        boolean requiresConfirmation
) {
    public static CommandSummary from(CommandCatalog.Entry entry) {
        CommandDescriptor d = entry.descriptor();
        return new CommandSummary(
                d.name(),
                d.displayName(),
                d.description(),
                d.category(),
                d.riskLevel().name(),
                entry.availability().name(),
                entry.confirmationRequired()
        );
    }
}
