package com.asiainfo.insights.infra.persistence;

import com.asiainfo.insights.core.generator.DuckDbDialect;
import com.asiainfo.insights.infra.config.InsightsConfig;
import io.agroal.api.AgroalDataSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

public class WarehouseConnectionPoolsTest {

    private static final String URL_A = "jdbc:duckdb:";
    private static final String URL_B = "jdbc:duckdb:?duckdb.read_only=false";

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private WarehouseConnectionPools pools;

    @BeforeEach
    public void setUp() {
        InsightsConfig config = Mockito.mock(InsightsConfig.class);
        when(config.getPoolMaxSize()).thenReturn(2);
        when(config.getPoolAcquisitionTimeoutSeconds()).thenReturn(2);
        when(config.getWarehouseUsername()).thenReturn(Optional.empty());
        when(config.getWarehousePassword()).thenReturn(Optional.empty());

        pools = new WarehouseConnectionPools();
        pools.config = config;
        pools.registry = meterRegistry;
    }

    @AfterEach
    public void tearDown() {
        pools.shutdown();
    }

    @Test
    public void testPoolReusedPerUrl() throws SQLException {
        AgroalDataSource first = pools.getOrCreate(URL_A, DuckDbDialect.INSTANCE);
        AgroalDataSource again = pools.getOrCreate(URL_A, DuckDbDialect.INSTANCE);
        AgroalDataSource other = pools.getOrCreate(URL_B, DuckDbDialect.INSTANCE);

        assertSame(first, again);
        assertNotSame(first, other);
        assertEquals(2, pools.size());
        assertEquals(2, pools.getCreateCount());
        assertEquals(2.0, meterRegistry.counter("insights.pool.created").count());

        try (Connection conn = first.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT 42")) {
            assertTrue(rs.next());
            assertEquals(42, rs.getInt(1));
        }
    }

    @Test
    public void testConcurrentFirstUseCreatesOnePool() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<AgroalDataSource>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return pools.getOrCreate(URL_A, DuckDbDialect.INSTANCE);
                }));
            }
            start.countDown();

            AgroalDataSource winner = futures.get(0).get();
            for (Future<AgroalDataSource> future : futures) {
                assertSame(winner, future.get());
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, pools.size());
        assertEquals(1, pools.getCreateCount());
    }

    @Test
    public void testShutdownClosesPools() {
        AgroalDataSource pool = pools.getOrCreate(URL_A, DuckDbDialect.INSTANCE);

        pools.shutdown();

        assertEquals(0, pools.size());
        assertThrows(SQLException.class, pool::getConnection);
        assertNotSame(pool, pools.getOrCreate(URL_A, DuckDbDialect.INSTANCE));
    }
}
