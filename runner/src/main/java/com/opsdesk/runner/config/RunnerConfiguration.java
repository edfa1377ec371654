package com.opsdesk.runner.config;

import com.opsdesk.runner.audit.CommandExecutionRepository;
import com.opsdesk.runner.command.CommandRegistry;
import com.opsdesk.runner.command.RunnableCommand;
import com.opsdesk.runner.command.impl.DatabaseCleanupCommand;
import com.opsdesk.runner.command.impl.EntityQueryCommand;
import com.opsdesk.runner.policy.EnvironmentPolicy;
import com.opsdesk.runner.query.EntityTypeResolver;
import com.opsdesk.runner.query.QueryExecutor;
import com.opsdesk.runner.query.ResultFormatter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.AutowireCapableBeanFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.util.ClassUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Composition root: builds the command registry and fills it at startup.
 *
 * Registration order:
 * <ol>
 *   <li>built-in commands (every {@link RunnableCommand} bean)</li>
 *   <li>classes listed under {@code opsdesk.runner.commands} with value true</li>
 *   <li>auto-discovered classes, only when {@code auto-discovery.default-enabled} is set</li>
 * </ol>
 * Configured and discovered classes are created through the bean factory so
 * they can inject collaborators. A class that fails to load, instantiate or
 * register is logged and skipped.
 */
@Configuration
@EnableConfigurationProperties(RunnerProperties.class)
@EnableScheduling
public class RunnerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RunnerConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public EnvironmentPolicy environmentPolicy(RunnerProperties properties) {
        return new EnvironmentPolicy(properties.toRestrictions(), properties.isRequireConfirmationForProduction());
    }

    @Bean
    public CommandDiscovery commandDiscovery() {
        return new CommandDiscovery(ClassUtils.getDefaultClassLoader());
    }

    @Bean
    public EntityQueryCommand entityQueryCommand(EntityTypeResolver entityTypes, QueryExecutor executor,
                                                 ResultFormatter formatter, Clock clock) {
        return new EntityQueryCommand(entityTypes, executor, formatter, clock);
    }

    @Bean
    public DatabaseCleanupCommand databaseCleanupCommand(CommandExecutionRepository executions,
                                                         PlatformTransactionManager transactionManager,
                                                         Clock clock) {
        return new DatabaseCleanupCommand(executions, transactionManager, clock);
    }

    @Bean
    public CommandRegistry commandRegistry(MeterRegistry meterRegistry,
                                           List<RunnableCommand> builtIns,
                                           RunnerProperties properties,
                                           CommandDiscovery discovery,
                                           AutowireCapableBeanFactory beanFactory) {
        CommandRegistry registry = new CommandRegistry(meterRegistry);
        registry.registerMany(builtIns);
        registerConfigured(registry, properties.getCommands(), beanFactory);
        if (properties.getAutoDiscovery().isEnabled()) {
            registerDiscovered(registry, properties.getAutoDiscovery(), discovery, beanFactory);
        }
        log.info("Command registry ready: {} command(s) {}", registry.names().size(), registry.names());
        return registry;
    }

    private void registerConfigured(CommandRegistry registry, Map<String, Boolean> configured,
                                    AutowireCapableBeanFactory beanFactory) {
        List<RunnableCommand> commands = new ArrayList<>();
        configured.forEach((className, enabled) -> {
            if (!Boolean.TRUE.equals(enabled)) {
                log.debug("Configured command {} is disabled", className);
                return;
            }
            try {
                Class<?> type = ClassUtils.forName(className, ClassUtils.getDefaultClassLoader());
                commands.add(instantiate(type.asSubclass(RunnableCommand.class), beanFactory));
            } catch (ClassNotFoundException | LinkageError | ClassCastException | BeansException e) {
                log.warn("Failed to register configured command {}: {}", className, e.getMessage());
            }
        });
        registry.registerMany(commands);
    }

    private void registerDiscovered(CommandRegistry registry, RunnerProperties.AutoDiscovery settings,
                                    CommandDiscovery discovery, AutowireCapableBeanFactory beanFactory) {
        List<String> skipped = new ArrayList<>();
        List<RunnableCommand> commands = new ArrayList<>();
        for (Class<? extends RunnableCommand> type : discovery.scan(settings.getBasePackages())) {
            if (registry.all().stream().anyMatch(c -> c.getClass() == type)) {
                continue;
            }
            if (!settings.isDefaultEnabled()) {
                skipped.add(type.getName());
                continue;
            }
            try {
                commands.add(instantiate(type, beanFactory));
            } catch (BeansException e) {
                log.warn("Failed to instantiate discovered command {}: {}", type.getName(), e.getMessage());
                skipped.add(type.getName());
            }
        }
        registry.registerMany(commands);
        if (!skipped.isEmpty()) {
            log.info("Discovered but not registered: {}", skipped);
        }
        discovery.reportUnregistered(skipped);
    }

    private static RunnableCommand instantiate(Class<? extends RunnableCommand> type,
                                               AutowireCapableBeanFactory beanFactory) {
        return beanFactory.createBean(type);
    }
}
