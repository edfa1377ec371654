package com.opsdesk.runner.api;

import com.opsdesk.runner.audit.CommandExecution;
import com.opsdesk.runner.command.CommandException;
import com.opsdesk.runner.command.CommandNotFoundException;
import com.opsdesk.runner.command.RiskLevel;
import com.opsdesk.runner.command.StubCommand;
import com.opsdesk.runner.command.option.OptionSpec;
import com.opsdesk.runner.policy.Availability;
import com.opsdesk.runner.query.EntityTypeInfo;
import com.opsdesk.runner.service.CommandCatalog;
import com.opsdesk.runner.service.CommandRunnerService;
import com.opsdesk.runner.service.CommandRunnerService.ExecutionReport;
import com.opsdesk.runner.service.CommandRunnerService.ExecutionRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web slice for CommandController and ApiExceptionHandler. The runner and
 * the catalog are mocks.
 */
@WebMvcTest(CommandController.class)
class CommandControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean CommandRunnerService runner;
    @MockitoBean CommandCatalog catalog;

    @BeforeEach
    void setUp() {
        when(runner.isEnabled()).thenReturn(true);
        when(catalog.environment()).thenReturn("staging");
    }

    private static CommandCatalog.Entry entry(String name, RiskLevel risk, Availability availability) {
        Map<String, OptionSpec> options = new LinkedHashMap<>();
        options.put("days", OptionSpec.text("Days").defaultValue("30").numeric().rules("integer|min:1").build());
        options.put("mode", OptionSpec.choice("Mode").required().choice("soft", "Soft").choice("hard", "Hard").build());
        return new CommandCatalog.Entry(StubCommand.descriptor(name, "Maintenance", risk, false, options),
                availability, risk != RiskLevel.LOW);
    }

    // ------------------------------------------------------------------
    // GET /commands
    // ------------------------------------------------------------------

    @Test
    void listCommands_groupsByCategory_andFlagsRestricted() throws Exception {
        when(catalog.byCategory(false)).thenReturn(Map.of("Maintenance",
                List.of(entry("cache:flush", RiskLevel.HIGH, Availability.RESTRICTED))));
        when(catalog.discovered()).thenReturn(List.of("com.acme.SyncCommand"));

        mockMvc.perform(get("/commands"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.environment").value("staging"))
                .andExpect(jsonPath("$.categories.Maintenance[0].name").value("cache:flush"))
                .andExpect(jsonPath("$.categories.Maintenance[0].riskLevel").value("HIGH"))
                .andExpect(jsonPath("$.categories.Maintenance[0].availability").value("RESTRICTED"))
                .andExpect(jsonPath("$.categories.Maintenance[0].requiresConfirmation").value(true))
                .andExpect(jsonPath("$.discovered[0]").value("com.acme.SyncCommand"));
    }

    @Test
    void listCommands_eligibleOnly_isPassedThrough() throws Exception {
        when(catalog.byCategory(true)).thenReturn(Map.of());

        mockMvc.perform(get("/commands").param("eligibleOnly", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categories").isEmpty());
        verify(catalog).byCategory(true);
    }

    @Test
    void listCommands_runnerDisabled_returns503() throws Exception {
        when(runner.isEnabled()).thenReturn(false);

        mockMvc.perform(get("/commands"))
                .andExpect(status().isServiceUnavailable());
        verify(catalog, never()).byCategory(any(Boolean.class));
    }

    // ------------------------------------------------------------------
    // GET /commands/{name}
    // ------------------------------------------------------------------

    @Test
    void getCommand_returnsOptionSchemaInOrder() throws Exception {
        when(catalog.describe("cache:flush")).thenReturn(entry("cache:flush", RiskLevel.MEDIUM, Availability.AVAILABLE));

        mockMvc.perform(get("/commands/{name}", "cache:flush"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.command.displayName").value("Display cache:flush"))
                .andExpect(jsonPath("$.options[0].key").value("days"))
                .andExpect(jsonPath("$.options[0].defaultValue").value("30"))
                .andExpect(jsonPath("$.options[0].rules[1]").value("MIN:1"))
                .andExpect(jsonPath("$.options[1].kind").value("CHOICE"))
                .andExpect(jsonPath("$.options[1].choices.hard").value("Hard"));
    }

    @Test
    void getCommand_unknown_returns404() throws Exception {
        when(catalog.describe("ghost")).thenThrow(new CommandNotFoundException("ghost"));

        mockMvc.perform(get("/commands/{name}", "ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.message").value("No command registered with name: 'ghost'"));
    }

    // ------------------------------------------------------------------
    // POST /commands/{name}/executions
    // ------------------------------------------------------------------

    @Test
    void execute_passesOptionsConfirmationAndOperator() throws Exception {
        when(runner.execute(any())).thenReturn(
                new ExecutionReport("entity:query", "Results...\n", 0, 0.042, null));

        mockMvc.perform(post("/commands/{name}/executions", "entity:query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Operator-Id", "42")
                        .header("X-Operator-Name", "alice")
                        .header("User-Agent", "ops-console/2")
                        .content("""
                                {"options":{"entity":"Member","query":"count()"},"confirmed":true}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.exitCode").value(0))
                .andExpect(jsonPath("$.output").value("Results...\n"))
                .andExpect(jsonPath("$.errorKind").doesNotExist());

        ArgumentCaptor<ExecutionRequest> captor = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(runner).execute(captor.capture());
        ExecutionRequest request = captor.getValue();
        assertThat(request.command()).isEqualTo("entity:query");
        assertThat(request.options()).containsEntry("query", "count()");
        assertThat(request.confirmed()).isTrue();
        assertThat(request.operator().id()).isEqualTo("42");
        assertThat(request.operator().name()).isEqualTo("alice");
        assertThat(request.userAgent()).isEqualTo("ops-console/2");
        assertThat(request.clientAddress()).isNotBlank();
    }

    @Test
    void execute_withoutBodyOrHeaders_runsAsCliUnconfirmed() throws Exception {
        when(runner.execute(any())).thenReturn(new ExecutionReport("report:show", "ok\n", 0, 0.001, null));

        mockMvc.perform(post("/commands/{name}/executions", "report:show"))
                .andExpect(status().isOk());

        ArgumentCaptor<ExecutionRequest> captor = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(runner).execute(captor.capture());
        assertThat(captor.getValue().options()).isEmpty();
        assertThat(captor.getValue().confirmed()).isFalse();
        assertThat(captor.getValue().operator().name()).isEqualTo("CLI");
    }

    @Test
    void execute_failedRun_isStill200_withErrorKind() throws Exception {
        when(runner.execute(any())).thenReturn(new ExecutionReport("entity:query",
                "Error: Method 'delete' is not allowed. Only read-only query methods are permitted.\n",
                1, 0.0, CommandException.Kind.DISALLOWED_VERB));

        mockMvc.perform(post("/commands/{name}/executions", "entity:query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"options\":{\"entity\":\"Member\",\"query\":\"delete()\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.exitCode").value(1))
                .andExpect(jsonPath("$.errorKind").value("DISALLOWED_VERB"));
    }

    @Test
    void execute_confirmationMissing_returns409() throws Exception {
        when(runner.execute(any())).thenThrow(new CommandException(CommandException.Kind.CONFIRMATION_REQUIRED,
                "Command 'db:cleanup' requires explicit confirmation"));

        mockMvc.perform(post("/commands/{name}/executions", "db:cleanup"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("CONFIRMATION_REQUIRED"))
                .andExpect(jsonPath("$.message").value("Command 'db:cleanup' requires explicit confirmation"));
    }

    @Test
    void execute_restricted_returns403() throws Exception {
        when(runner.execute(any())).thenThrow(new CommandException(CommandException.Kind.COMMAND_RESTRICTED,
                "Command 'data:wipe' is not available in the production environment"));

        mockMvc.perform(post("/commands/{name}/executions", "data:wipe"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("COMMAND_RESTRICTED"));
    }

    // ------------------------------------------------------------------
    // GET /executions, GET /entity-types
    // ------------------------------------------------------------------

    @Test
    void recentExecutions_mapsAuditRows() throws Exception {
        CommandExecution row = new CommandExecution("db:cleanup", "staging", Instant.parse("2026-03-15T12:00:00Z"));
        row.setUserName("alice");
        row.setExitCode(0);
        row.setExecutionTime(0.5);
        row.setOptions("{\"days\":30}");
        when(runner.recentExecutions(5)).thenReturn(List.of(row));

        mockMvc.perform(get("/executions").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].command").value("db:cleanup"))
                .andExpect(jsonPath("$[0].userName").value("alice"))
                .andExpect(jsonPath("$[0].options").value("{\"days\":30}"))
                .andExpect(jsonPath("$[0].startedAt").value("2026-03-15T12:00:00Z"));
    }

    @Test
    void entityTypes_listsFields() throws Exception {
        when(catalog.entityTypes()).thenReturn(List.of(new EntityTypeInfo("CommandExecution", CommandExecution.class,
                List.of(new EntityTypeInfo.Field("id", Long.class, true),
                        new EntityTypeInfo.Field("command", String.class, false)))));

        mockMvc.perform(get("/entity-types"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("CommandExecution"))
                .andExpect(jsonPath("$[0].handle").value(CommandExecution.class.getName()))
                .andExpect(jsonPath("$[0].fields[0].id").value(true))
                .andExpect(jsonPath("$[1]").doesNotExist())
                .andExpect(jsonPath("$[0].fields[1].type").value("String"));
    }
}
