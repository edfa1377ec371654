package com.opsdesk.runner.service;

import com.opsdesk.runner.command.CommandNotFoundException;
import com.opsdesk.runner.command.CommandRegistry;
import com.opsdesk.runner.command.RiskLevel;
import com.opsdesk.runner.command.StubCommand;
import com.opsdesk.runner.config.CommandDiscovery;
import com.opsdesk.runner.config.RunnerProperties;
import com.opsdesk.runner.policy.Availability;
import com.opsdesk.runner.policy.EnvironmentPolicy;
import com.opsdesk.runner.query.EntityTypeResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommandCatalogTest {

    @Mock CommandDiscovery discovery;
    @Mock EntityTypeResolver entityTypes;

    CommandRegistry registry;
    RunnerProperties properties;

    @BeforeEach
    void setUp() {
        registry = new CommandRegistry(new SimpleMeterRegistry());
        registry.register(StubCommand.of("report:show", "Reports", RiskLevel.LOW));
        registry.register(StubCommand.of("cache:flush", "Maintenance", RiskLevel.MEDIUM));
        registry.register(StubCommand.of("data:wipe", "Danger", RiskLevel.HIGH));
        properties = new RunnerProperties();
    }

    private CommandCatalog catalogIn(String environment) {
        properties.setEnvironment(environment);
        EnvironmentPolicy policy = new EnvironmentPolicy(properties.toRestrictions(),
                properties.isRequireConfirmationForProduction());
        return new CommandCatalog(registry, policy, properties, discovery, entityTypes);
    }

    private static List<String> names(Map<String, List<CommandCatalog.Entry>> grouped) {
        return grouped.values().stream().flatMap(List::stream).map(e -> e.descriptor().name()).toList();
    }

    @Test
    void local_showsEverything() {
        Map<String, List<CommandCatalog.Entry>> grouped = catalogIn("local").byCategory(true);

        assertThat(grouped).containsOnlyKeys("Reports", "Maintenance", "Danger");
        assertThat(names(grouped)).containsExactlyInAnyOrder("report:show", "cache:flush", "data:wipe");
    }

    @Test
    void staging_flagsRestrictedCommands_andHidesThemWhenEligibleOnly() {
        CommandCatalog catalog = catalogIn("staging");

        CommandCatalog.Entry wipe = catalog.byCategory(false).get("Danger").get(0);
        assertThat(wipe.availability()).isEqualTo(Availability.RESTRICTED);
        assertThat(wipe.confirmationRequired()).isTrue();

        assertThat(catalog.byCategory(true)).doesNotContainKey("Danger");
    }

    @Test
    void production_hidesDisabledCommands_everywhere() {
        CommandCatalog catalog = catalogIn("production");

        assertThat(names(catalog.byCategory(false))).containsExactly("report:show");
        assertThat(catalog.describe("report:show").confirmationRequired()).isTrue();
        assertThatThrownBy(() -> catalog.describe("data:wipe")).isInstanceOf(CommandNotFoundException.class);
    }

    @Test
    void describe_unknown_isNotFound() {
        assertThatThrownBy(() -> catalogIn("local").describe("ghost")).isInstanceOf(CommandNotFoundException.class);
    }

    @Test
    void discovered_andEnvironment_passThrough() {
        when(discovery.unregistered()).thenReturn(List.of("com.acme.SyncCommand"));

        CommandCatalog catalog = catalogIn("staging");

        assertThat(catalog.discovered()).containsExactly("com.acme.SyncCommand");
        assertThat(catalog.environment()).isEqualTo("staging");
    }
}
