package com.switchboard.core.store;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class OperationStoreConfigTest {

    @SuppressWarnings("unchecked")
    private static ObjectProvider<DataSource> provider(DataSource dataSource) {
        ObjectProvider<DataSource> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(dataSource);
        return provider;
    }

    @Test
    @DisplayName("falls back to the in-memory store without a DataSource")
    void inMemoryWithoutDataSource() throws Exception {
        OperationStore store = new OperationStoreConfig()
                .operationStore(provider(null), new StoreProperties(), Clock.systemUTC());

        assertInstanceOf(InMemoryOperationStore.class, store);
    }

    @Test
    @DisplayName("uses the JDBC store and creates its tables when a DataSource exists")
    void jdbcWithDataSource() throws Exception {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:config-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");

        OperationStore store = new OperationStoreConfig()
                .operationStore(provider(dataSource), new StoreProperties(), Clock.systemUTC());

        assertInstanceOf(JdbcOperationStore.class, store);
        var created = store.createOperation("good morning", "alice");
        assertEquals(created, store.getOperation(created.id()));
    }
}
