package com.asiainfo.insights.infra.persistence;

import com.asiainfo.insights.core.generator.DuckDbDialect;
import com.asiainfo.insights.core.model.InsightType;
import com.asiainfo.insights.core.schema.WarehouseApplication;
import com.asiainfo.insights.infra.config.InsightsConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agroal.api.AgroalDataSource;
import io.agroal.api.configuration.supplier.AgroalDataSourceConfigurationSupplier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;

/**
 * 内存 DuckDB + 单连接 Agroal 池。池只保留一个连接，所以同一个内存库在整个用例内可见
 */
public class DuckDbTestSupport implements AutoCloseable {

    private final AgroalDataSource dataSource;
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private DuckDbTestSupport(AgroalDataSource dataSource) {
        this.dataSource = dataSource;
    }

    public static DuckDbTestSupport open() throws SQLException {
        AgroalDataSourceConfigurationSupplier supplier = new AgroalDataSourceConfigurationSupplier()
                .metricsEnabled(false)
                .connectionPoolConfiguration(cp -> cp
                        .maxSize(1)
                        .acquisitionTimeout(Duration.ofSeconds(5))
                        .connectionFactoryConfiguration(cf -> cf.jdbcUrl("jdbc:duckdb:")));
        return new DuckDbTestSupport(AgroalDataSource.from(supplier));
    }

    public DuckDbTestSupport execute(String... statements) throws SQLException {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        }
        return this;
    }

    /**
     * website_event with the internal schema columns.
     */
    public DuckDbTestSupport createInternalTable() throws SQLException {
        return execute("CREATE TABLE website_event (id BIGINT, website_id VARCHAR, session_id VARCHAR, "
                + "event_name VARCHAR, created_at BIGINT, url_path VARCHAR, url_query VARCHAR, "
                + "referrer_domain VARCHAR, page_title VARCHAR, browser VARCHAR, os VARCHAR, device VARCHAR, "
                + "country VARCHAR, region VARCHAR, city VARCHAR, language VARCHAR)");
    }

    public DuckDbTestSupport insertInternalEvent(long id, String websiteId, String sessionId, String eventName,
                                                 long createdAt, String browser, String country) throws SQLException {
        return execute(String.format("INSERT INTO website_event (id, website_id, session_id, event_name, created_at, "
                        + "browser, country) VALUES (%d, '%s', '%s', '%s', %d, '%s', '%s')",
                id, websiteId, sessionId, eventName, createdAt, browser, country));
    }

    public AgroalDataSource dataSource() {
        return dataSource;
    }

    public SimpleMeterRegistry meterRegistry() {
        return meterRegistry;
    }

    public StatementExecutor executor() {
        StatementExecutor executor = new StatementExecutor();
        executor.registry = meterRegistry;
        return executor;
    }

    public ResolvedInsight target(InsightType type, WarehouseApplication application) {
        return new ResolvedInsight(type, application, dataSource, DuckDbDialect.INSTANCE);
    }

    /**
     * Registry whose internal store is this database; warehouse pools are real but unused.
     */
    public WarehouseApplicationRegistry registry(InsightsConfig config) {
        WarehouseConnectionPools pools = new WarehouseConnectionPools();
        pools.config = config;
        pools.registry = meterRegistry;

        WarehouseApplicationRegistry registry = new WarehouseApplicationRegistry();
        registry.config = config;
        registry.objectMapper = new ObjectMapper();
        registry.pools = pools;
        registry.internalDataSource = dataSource;
        return registry;
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
