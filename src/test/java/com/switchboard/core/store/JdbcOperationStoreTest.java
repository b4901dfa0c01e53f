package com.switchboard.core.store;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the store contract against an in-memory H2 database.
 */
class JdbcOperationStoreTest extends OperationStoreContractTest {

    private JdbcDataSource dataSource;

    @Override
    protected OperationStore createStore(Clock clock) throws Exception {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:store-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        var jdbcStore = new JdbcOperationStore(dataSource, clock);
        jdbcStore.createTables();
        jdbcStore.initialize();
        return jdbcStore;
    }

    @Test
    @DisplayName("a new store over existing rows keeps recency order")
    void sequenceSurvivesRestart() throws Exception {
        store.createOperation("before restart", "alice");

        var restarted = new JdbcOperationStore(dataSource, Clock.systemUTC());
        restarted.createTables();
        restarted.initialize();
        restarted.createOperation("after restart", "alice");

        assertEquals("after restart", restarted.listOperations(1).get(0).userRequest());
    }
}
