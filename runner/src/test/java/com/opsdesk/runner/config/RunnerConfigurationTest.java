package com.opsdesk.runner.config;

import com.opsdesk.runner.command.CommandDescriptor;
import com.opsdesk.runner.command.RiskLevel;
import com.opsdesk.runner.command.StubCommand;
import com.opsdesk.runner.policy.Availability;
import com.opsdesk.runner.policy.EnvironmentPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Binding of {@code opsdesk.runner.*} into the environment gate.
 */
class RunnerConfigurationTest {

    @Configuration
    @EnableConfigurationProperties(RunnerProperties.class)
    static class PolicyOnly {
        @Bean
        EnvironmentPolicy environmentPolicy(RunnerProperties properties) {
            return new RunnerConfiguration().environmentPolicy(properties);
        }
    }

    final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PolicyOnly.class);

    static CommandDescriptor command(RiskLevel risk) {
        return StubCommand.descriptor("cmd:" + risk, "X", risk, false, Map.of());
    }

    @Test
    void environment_defaultsToLocal_whenProfilesAreActive() {
        contextRunner
                .withPropertyValues("spring.profiles.active=production,metrics")
                .run(ctx -> {
                    RunnerProperties properties = ctx.getBean(RunnerProperties.class);
                    assertThat(properties.getEnvironment()).isEqualTo("local");
                    assertThat(properties.getEnvironmentRestrictions()).containsKeys("production", "staging");
                });
    }

    @Test
    void environmentFromProfileList_keepsProductionGate() {
        contextRunner
                .withPropertyValues(
                        "spring.profiles.active=production,metrics",
                        "opsdesk.runner.environment=${spring.profiles.active}")
                .run(ctx -> {
                    String environment = ctx.getBean(RunnerProperties.class).getEnvironment();
                    EnvironmentPolicy policy = ctx.getBean(EnvironmentPolicy.class);

                    assertThat(environment).isEqualTo("production,metrics");
                    assertThat(policy.availability(command(RiskLevel.HIGH), environment))
                            .isEqualTo(Availability.DISABLED);
                    assertThat(policy.availability(command(RiskLevel.LOW), environment))
                            .isEqualTo(Availability.AVAILABLE);
                    assertThat(policy.requiresConfirmation(command(RiskLevel.LOW), environment)).isTrue();
                });
    }

    @Test
    void boundRestrictions_addNewEnvironment() {
        contextRunner
                .withPropertyValues(
                        "opsdesk.runner.environment=qa",
                        "opsdesk.runner.environment-restrictions.qa.allowed-risk-levels=LOW,MEDIUM",
                        "opsdesk.runner.environment-restrictions.qa.disable-unless-confirmed=false")
                .run(ctx -> {
                    EnvironmentPolicy policy = ctx.getBean(EnvironmentPolicy.class);

                    assertThat(policy.availability(command(RiskLevel.HIGH), "qa")).isEqualTo(Availability.RESTRICTED);
                    assertThat(policy.availability(command(RiskLevel.MEDIUM), "qa")).isEqualTo(Availability.AVAILABLE);
                });
    }
}
