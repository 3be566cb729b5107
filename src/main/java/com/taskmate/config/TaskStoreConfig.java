package com.taskmate.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Clock shared by the task stores. With {@code taskmate.store.storage=database} the JDBC store runs
 * on the pooled {@code DataSource} and {@code NamedParameterJdbcTemplate} that Spring Boot builds
 * from {@code spring.datasource.*}.
 */
@Configuration
public class TaskStoreConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }
}
