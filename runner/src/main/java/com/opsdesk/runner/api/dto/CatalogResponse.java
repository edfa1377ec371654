package com.opsdesk.runner.api.dto;

import java.util.List;
import java.util.Map;

/**
 * Response body for GET /commands.
 *
 * @param discovered command classes found on the classpath but not registered
 */
public record CatalogResponse(
        String                              environment,
        Map<String, List<CommandSummary>>   categories,
        List<String>                        discovered
) {}
