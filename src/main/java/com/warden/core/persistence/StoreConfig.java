package com.warden.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.events.EventStore;
import com.warden.core.events.InMemoryEventStore;
import com.warden.core.jobs.InMemoryJobStore;
import com.warden.core.jobs.JobStore;
import com.warden.core.routines.InMemoryRoutineStore;
import com.warden.core.routines.RoutineProperties;
import com.warden.core.routines.RoutineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Selects the job, event and routine stores.
 * <p>
 * With {@code warden.store.type=jdbc} a PostgreSQL {@link DataSource} is built from
 * {@code spring.datasource.*} and the tables are created on startup. Otherwise in-memory
 * stores are used: suitable for development, not durable across restarts.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = "warden.store.type", havingValue = "jdbc")
    @EnableConfigurationProperties(DataSourceProperties.class)
    static class JdbcStores {

        @Bean
        public DataSource dataSource(DataSourceProperties properties) {
            log.info("Configuring JDBC stores ({})", properties.getUrl());
            return properties.initializeDataSourceBuilder().build();
        }

        @Bean
        public JobStore jdbcJobStore(DataSource dataSource, ObjectMapper objectMapper) throws Exception {
            var store = new JdbcJobStore(dataSource, objectMapper);
            store.createTables();
            return store;
        }

        @Bean
        public EventStore jdbcEventStore(DataSource dataSource, ObjectMapper objectMapper) throws Exception {
            var store = new JdbcEventStore(dataSource, objectMapper);
            store.createTables();
            return store;
        }

        @Bean
        public RoutineStore jdbcRoutineStore(DataSource dataSource, ObjectMapper objectMapper,
                                             RoutineProperties routineProperties) throws Exception {
            var store = new JdbcRoutineStore(dataSource, objectMapper, routineProperties.getRunHistoryLimit());
            store.createTables();
            return store;
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = "warden.store.type", havingValue = "memory", matchIfMissing = true)
    static class InMemoryStores {

        @Bean
        public JobStore inMemoryJobStore() {
            log.info("No database configured; using in-memory stores (state will not persist across restarts)");
            return new InMemoryJobStore();
        }

        @Bean
        public EventStore inMemoryEventStore() {
            return new InMemoryEventStore();
        }

        @Bean
        public RoutineStore inMemoryRoutineStore(RoutineProperties routineProperties) {
            return new InMemoryRoutineStore(routineProperties.getRunHistoryLimit());
        }
    }
}
