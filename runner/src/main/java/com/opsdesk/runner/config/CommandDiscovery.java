package com.opsdesk.runner.config;

import com.opsdesk.runner.command.RunnableCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.annotation.ClassPathScanningCandidateComponentProvider;
import org.springframework.core.type.filter.AssignableTypeFilter;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds concrete {@link RunnableCommand} classes on the classpath.
 *
 * Remembers what the last scan found but did not register, so the catalog
 * can list candidates an administrator may want to enable.
 */
public class CommandDiscovery {

    private static final Logger log = LoggerFactory.getLogger(CommandDiscovery.class);

    private final ClassLoader classLoader;
    private volatile List<String> unregistered = List.of();

    public CommandDiscovery(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    public List<Class<? extends RunnableCommand>> scan(List<String> basePackages) {
        ClassPathScanningCandidateComponentProvider scanner =
                new ClassPathScanningCandidateComponentProvider(false);
        scanner.addIncludeFilter(new AssignableTypeFilter(RunnableCommand.class));

        Set<Class<? extends RunnableCommand>> found = new LinkedHashSet<>();
        for (String basePackage : basePackages) {
            for (BeanDefinition candidate : scanner.findCandidateComponents(basePackage)) {
                String className = candidate.getBeanClassName();
                try {
                    found.add(ClassUtils.forName(className, classLoader).asSubclass(RunnableCommand.class));
                } catch (ClassNotFoundException | LinkageError e) {
                    log.warn("Skipping discovered command {}: {}", className, e.getMessage());
                }
            }
        }
        log.info("Command discovery found {} candidate(s) in {}", found.size(), basePackages);
        return new ArrayList<>(found);
    }

    /** Class names found by the last scan that were not registered. */
    public List<String> unregistered() {
        return unregistered;
    }

    void reportUnregistered(List<String> classNames) {
        this.unregistered = Collections.unmodifiableList(new ArrayList<>(classNames));
    }
}
