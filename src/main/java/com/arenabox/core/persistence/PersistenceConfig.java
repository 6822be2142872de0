package com.arenabox.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Wires the JDBC stores to the application {@link DataSource} and makes sure their tables exist.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    public InstanceTracker instanceTracker(DataSource dataSource) throws Exception {
        log.info("Configuring JDBC instance tracker");
        var tracker = new JdbcInstanceTracker(dataSource);
        tracker.createTables();
        return tracker;
    }

    @Bean
    public ChallengeStore challengeStore(DataSource dataSource) throws Exception {
        var store = new ChallengeStore(dataSource);
        store.createTables();
        return store;
    }

    @Bean
    public OrchestratorConfigStore orchestratorConfigStore(DataSource dataSource) throws Exception {
        var store = new OrchestratorConfigStore(dataSource);
        store.createTables();
        return store;
    }
}
