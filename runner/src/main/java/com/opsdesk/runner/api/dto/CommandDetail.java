package com.opsdesk.runner.api.dto;

import com.opsdesk.runner.command.CommandDescriptor;
import com.opsdesk.runner.service.CommandCatalog;

import java.util.List;

/**
 * Response body for GET /commands/{name}: the catalog entry plus its option
 * schema in rendering order.
 */
public record CommandDetail(
        CommandSummary       command,
        List<OptionResponse> options
) {
    public static CommandDetail from(CommandCatalog.Entry entry) {
        CommandDescriptor d = entry.descriptor();
        return new CommandDetail(
                CommandSummary.from(entry),
                d.options().entrySet().stream()
                        .map(e -> OptionResponse.from(e.getKey(), e.getValue()))
                        .toList()
        );
    }
}
