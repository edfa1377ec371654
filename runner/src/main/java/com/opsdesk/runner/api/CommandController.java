package com.opsdesk.runner.api;

import com.opsdesk.runner.api.dto.CatalogResponse;
import com.opsdesk.runner.api.dto.CommandDetail;
import com.opsdesk.runner.api.dto.CommandSummary;
import com.opsdesk.runner.api.dto.EntityTypeResponse;
import com.opsdesk.runner.api.dto.ExecuteCommandRequest;
import com.opsdesk.runner.api.dto.ExecutionLogResponse;
import com.opsdesk.runner.api.dto.ExecutionResponse;
import com.opsdesk.runner.command.OperatorIdentity;
import com.opsdesk.runner.service.CommandCatalog;
import com.opsdesk.runner.service.CommandRunnerService;
import com.opsdesk.runner.service.CommandRunnerService.ExecutionRequest;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for the command runner.
 *
 * GET  /commands                    - catalog for the current environment, grouped by category
 * GET  /commands/{name}             - one command with its option schema
 * POST /commands/{name}/executions  - run a command
 * GET  /executions                  - most recent audit records
 * GET  /entity-types                - entity types available to entity:query
 *
 * The operator is identified by the X-Operator-Id, X-Operator-Name and
 * X-Operator-Email headers; requests without them run as "CLI".
 */
@RestController
public class CommandController {

    static final String OPERATOR_ID    = "X-Operator-Id";
    static final String OPERATOR_NAME  = "X-Operator-Name";
    static final String OPERATOR_EMAIL = "X-Operator-Email";

    private final CommandRunnerService runner;
    private final CommandCatalog       catalog;

    public CommandController(CommandRunnerService runner, CommandCatalog catalog) {
        this.runner  = runner;
        this.catalog = catalog;
    }

    /**
     * @param eligibleOnly when true, RESTRICTED commands are left out instead of flagged
     */
    @GetMapping("/commands")
    public CatalogResponse listCommands(@RequestParam(defaultValue = "false") boolean eligibleOnly) {
        requireEnabled();
        Map<String, List<CommandSummary>> categories = new LinkedHashMap<>();
        catalog.byCategory(eligibleOnly).forEach((category, entries) ->
                categories.put(category, entries.stream().map(CommandSummary::from).toList()));
        return new CatalogResponse(catalog.environment(), categories, catalog.discovered());
    }

    /** Returns 404 for unknown commands and for commands disabled in this environment. */
    @GetMapping("/commands/{name}")
    public CommandDetail getCommand(@PathVariable String name) {
        requireEnabled();
        return CommandDetail.from(catalog.describe(name));
    }

    /**
     * Run a command.
     *
     * Example:
     *   curl -X POST http://localhost:8080/commands/entity:query/executions \
     *     -H "Content-Type: application/json" -H "X-Operator-Name: alice" \
     *     -d '{"options":{"entity":"CommandExecution","query":"latest()->take(5)->get()"}}'
     *
     * HTTP 200 - the command ran; exitCode tells whether it succeeded
     * HTTP 403 - the command is disabled in this environment
     * HTTP 404 - no such command
     * HTTP 409 - confirmation required but not given
     */
    @PostMapping("/commands/{name}/executions")
    public ExecutionResponse execute(@PathVariable String name,
                                     @RequestBody(required = false) ExecuteCommandRequest body,
                                     @RequestHeader(value = OPERATOR_ID, required = false) String operatorId,
                                     @RequestHeader(value = OPERATOR_NAME, required = false) String operatorName,
                                     @RequestHeader(value = OPERATOR_EMAIL, required = false) String operatorEmail,
                                     HttpServletRequest http) {
        requireEnabled();
        ExecuteCommandRequest req = body != null ? body : new ExecuteCommandRequest(null, false);
        ExecutionRequest request = new ExecutionRequest(
                name,
                req.options(),
                req.confirmed(),
                new OperatorIdentity(operatorId, operatorName, operatorEmail),
                http.getRemoteAddr(),
                http.getHeader(HttpHeaders.USER_AGENT));
        return ExecutionResponse.from(runner.execute(request));
    }

    @GetMapping("/executions")
    public List<ExecutionLogResponse> recentExecutions(@RequestParam(defaultValue = "20") int limit) {
        requireEnabled();
        return runner.recentExecutions(limit).stream()
                .map(ExecutionLogResponse::from)
                .toList();
    }

    @GetMapping("/entity-types")
    public List<EntityTypeResponse> entityTypes() {
        requireEnabled();
        return catalog.entityTypes().stream()
                .map(EntityTypeResponse::from)
                .toList();
    }

    private void requireEnabled() {
        if (!runner.isEnabled()) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Command runner is disabled");
        }
    }
}
