package com.opsdesk.runner.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.opsdesk.runner.config.RunnerProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/** Beans the JPA slice does not provide. "Today" is 2026-03-15 UTC. */
@TestConfiguration
@EnableConfigurationProperties(RunnerProperties.class)
class QueryTestConfig {

    static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");

    @Bean
    Clock clock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Bean
    ObjectMapper objectMapper() {
        return JsonMapper.builder().findAndAddModules().build();
    }
}
