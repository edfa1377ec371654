package com.opsdesk.runner.command.impl;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.opsdesk.runner.command.CommandException;
import com.opsdesk.runner.command.CommandExecutionContext;
import com.opsdesk.runner.command.CommandResult;
import com.opsdesk.runner.command.OperatorIdentity;
import com.opsdesk.runner.command.RiskLevel;
import com.opsdesk.runner.command.option.OptionKind;
import com.opsdesk.runner.query.EntityTypeInfo;
import com.opsdesk.runner.query.EntityTypeResolver;
import com.opsdesk.runner.query.ExecutionOutcome;
import com.opsdesk.runner.query.QueryExecutor;
import com.opsdesk.runner.query.QueryRejectedException;
import com.opsdesk.runner.query.ResultFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EntityQueryCommandTest {

    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");

    @Mock EntityTypeResolver entityTypes;
    @Mock QueryExecutor executor;

    EntityQueryCommand command;
    CommandExecutionContext ctx;

    static class Account {}

    @BeforeEach
    void setUp() {
        EntityTypeInfo account = new EntityTypeInfo("Account", Account.class,
                List.of(new EntityTypeInfo.Field("id", Long.class, true)));
        lenient().when(entityTypes.resolve("Account")).thenReturn(Optional.of(account));

        command = new EntityQueryCommand(entityTypes, executor,
                new ResultFormatter(JsonMapper.builder().build()),
                Clock.fixed(NOW, ZoneOffset.UTC));
        ctx = new CommandExecutionContext(new OperatorIdentity("7", "Ops", null), "staging", NOW);
    }

    // -------------------------------------------------------------------------
    // Descriptor
    // -------------------------------------------------------------------------

    @Test
    void descriptor_isLowRisk_withDynamicEntityChoices() {
        when(entityTypes.choices()).thenReturn(Map.of(Account.class.getName(), "Account"));

        assertThat(command.descriptor().name()).isEqualTo("entity:query");
        assertThat(command.descriptor().riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(command.descriptor().requiresConfirmation()).isFalse();
        assertThat(command.descriptor().options().get("entity").kind()).isEqualTo(OptionKind.CHOICE);
        assertThat(command.descriptor().options().get("entity").resolvedChoices())
                .containsEntry(Account.class.getName(), "Account");
        assertThat(command.descriptor().options().get("query").kind()).isEqualTo(OptionKind.LONG_TEXT);
    }

    // -------------------------------------------------------------------------
    // validate
    // -------------------------------------------------------------------------

    @Test
    void validate_missingQuery_isMissingRequired() {
        assertThatThrownBy(() -> command.validate(Map.of("entity", "Account")))
                .isInstanceOfSatisfying(CommandException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CommandException.Kind.MISSING_REQUIRED));
    }

    @Test
    void validate_unknownEntity_isRejected() {
        when(entityTypes.resolve("Ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> command.validate(Map.of("entity", "Ghost", "query", "get()")))
                .isInstanceOfSatisfying(CommandException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CommandException.Kind.UNKNOWN_ENTITY_TYPE));
    }

    @Test
    void validate_writeVerb_isRejected() {
        assertThatThrownBy(() -> command.validate(Map.of("entity", "Account", "query", "where('id', 1)->delete()")))
                .isInstanceOf(QueryRejectedException.class)
                .hasMessageContaining("'delete'");
    }

    @Test
    void execute_rejectedQuery_neverReachesTheExecutor() {
        assertThatThrownBy(() -> command.execute(Map.of("entity", "Account", "query", "truncate()"), ctx))
                .isInstanceOf(QueryRejectedException.class);
        verify(executor, never()).run(any(), any());
    }

    // -------------------------------------------------------------------------
    // execute
    // -------------------------------------------------------------------------

    @Test
    void execute_success_rendersResults() {
        when(executor.run("Account", "where('id', 1)->get()"))
                .thenReturn(ExecutionOutcome.success(List.of(Map.of("id", 1)), 0.012));

        CommandResult result = command.execute(
                Map.of("entity", "Account", "query", "  where('id', 1)->get() "), ctx);

        assertThat(result.exitCode()).isZero();
        assertThat(result.elapsedSeconds()).isEqualTo(0.012);
        assertThat(result.output())
                .contains("Command: entity:query")
                .contains("User: Ops")
                .contains("Environment: staging")
                .contains("Executing: Account::where('id', 1)->get()")
                .contains("Query executed successfully")
                .contains("\"id\" : 1")
                .contains("Status: SUCCESS");
    }

    @Test
    void execute_failure_reportsErrorWithExitCodeOne() {
        when(executor.run("Account", "where('nope', 1)->get()"))
                .thenReturn(ExecutionOutcome.failure("Unknown field 'nope' on Account. Available fields: id", 0.002));

        CommandResult result = command.execute(Map.of("entity", "Account", "query", "where('nope', 1)->get()"), ctx);

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.output())
                .contains("EXECUTION ERROR")
                .contains("Error: Unknown field 'nope' on Account")
                .doesNotContain("Query executed successfully");
    }
}
