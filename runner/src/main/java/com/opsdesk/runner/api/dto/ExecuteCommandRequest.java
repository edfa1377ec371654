package com.opsdesk.runner.api.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request body for POST /commands/{name}/executions.
 *
 * @param confirmed the operator acknowledged the confirmation prompt
 */
public record ExecuteCommandRequest(Map<String, Object> options, boolean confirmed) {

    public ExecuteCommandRequest {
        options = options == null ? new LinkedHashMap<>() : new LinkedHashMap<>(options);
    }
}
