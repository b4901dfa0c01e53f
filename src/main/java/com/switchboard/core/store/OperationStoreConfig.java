package com.switchboard.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Provides the {@link OperationStore} bean.
 * <p>
 * When a {@link DataSource} is available (the {@code postgres} profile), a
 * {@link JdbcOperationStore} persists operations and feedback. Otherwise the
 * {@link InMemoryOperationStore} is used; it loses everything on restart.
 */
@Configuration
public class OperationStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(OperationStoreConfig.class);

    @Bean
    public OperationStore operationStore(ObjectProvider<DataSource> dataSource,
                                         StoreProperties properties,
                                         Clock clock) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory operation store (state will not persist across restarts)");
            return new InMemoryOperationStore(clock);
        }
        log.info("Configuring JDBC operation store");
        var store = new JdbcOperationStore(ds, clock);
        if (properties.isInitializeSchema()) {
            store.createTables();
        }
        store.initialize();
        return store;
    }
}
