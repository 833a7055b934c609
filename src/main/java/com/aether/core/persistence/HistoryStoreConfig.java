package com.aether.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Spring {@link Configuration} that provides the {@link HistoryStore} bean.
 * <p>
 * {@code aether.history.store=jdbc} (the default) persists history through the
 * configured {@link DataSource}: an embedded H2 file database unless a PostgreSQL URL
 * is supplied. {@code aether.history.store=memory} keeps history in memory, which is
 * suitable for development and testing but not durable across restarts.
 */
@Configuration
public class HistoryStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(HistoryStoreConfig.class);

    /**
     * JDBC-backed history store. Creates the required tables on startup.
     */
    @Bean
    @ConditionalOnProperty(prefix = "aether.history", name = "store", havingValue = "jdbc", matchIfMissing = true)
    public HistoryStore jdbcHistoryStore(DataSource dataSource, Clock clock) throws Exception {
        log.info("Configuring JDBC history store");
        var store = new JdbcHistoryStore(dataSource, clock);
        store.createTables();
        return store;
    }

    /**
     * In-memory history store. State is lost on application restart.
     */
    @Bean
    @ConditionalOnProperty(prefix = "aether.history", name = "store", havingValue = "memory")
    public HistoryStore memoryHistoryStore(Clock clock) {
        log.info("Using in-memory history store (state will not persist across restarts)");
        return new InMemoryHistoryStore(clock);
    }
}
