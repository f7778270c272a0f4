package com.asiainfo.insights.infra.persistence;

import com.asiainfo.insights.core.exception.BackendUnavailableException;
import com.asiainfo.insights.core.generator.ConnectionStrings;
import com.asiainfo.insights.core.generator.SqlDialect;
import com.asiainfo.insights.infra.config.InsightsConfig;
import io.agroal.api.AgroalDataSource;
import io.agroal.api.configuration.supplier.AgroalDataSourceConfigurationSupplier;
import io.agroal.api.security.NamePrincipal;
import io.agroal.api.security.SimplePassword;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.runtime.Shutdown;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 数仓连接池缓存：每个连接串一个 Agroal 池，首次使用时创建。
 * <p>
 * computeIfAbsent 保证并发首次访问同一连接串时只有一个池被创建；
 * 创建失败不会留下映射，下次访问重新尝试
 */
@ApplicationScoped
public class WarehouseConnectionPools {

    private static final Logger log = LoggerFactory.getLogger(WarehouseConnectionPools.class);

    // jdbcUrl -> pool
    private final Map<String, AgroalDataSource> pools = new ConcurrentHashMap<>();

    private final AtomicInteger createCount = new AtomicInteger(0);

    @Inject
    InsightsConfig config;
    @Inject
    MeterRegistry registry;

    /**
     * 获取或创建连接池
     *
     * @param jdbcUrl 连接串，同时作为池的 key
     * @param dialect 决定新连接的初始化语句
     */
    public AgroalDataSource getOrCreate(String jdbcUrl, SqlDialect dialect) {
        AgroalDataSource pool = pools.get(jdbcUrl);
        if (pool != null) {
            return pool;
        }
        return pools.computeIfAbsent(jdbcUrl, key -> {
            AgroalDataSource created = createPool(key, dialect);
            registry.counter("insights.pool.created").increment();
            log.info("Created warehouse pool: {} (total: {})", ConnectionStrings.redact(key),
                    createCount.incrementAndGet());
            return created;
        });
    }

    private AgroalDataSource createPool(String jdbcUrl, SqlDialect dialect) {
        String initSql = dialect.initSql();
        AgroalDataSourceConfigurationSupplier supplier = new AgroalDataSourceConfigurationSupplier()
                .metricsEnabled(false)
                .connectionPoolConfiguration(cp -> cp
                        .maxSize(config.getPoolMaxSize())
                        .acquisitionTimeout(Duration.ofSeconds(config.getPoolAcquisitionTimeoutSeconds()))
                        .connectionFactoryConfiguration(cf -> {
                            cf.jdbcUrl(jdbcUrl);
                            if (initSql != null) {
                                cf.initialSql(initSql);
                            }
                            config.getWarehouseUsername().ifPresent(user -> cf.principal(new NamePrincipal(user)));
                            config.getWarehousePassword().ifPresent(pwd -> cf.credential(new SimplePassword(pwd)));
                            return cf;
                        }));
        try {
            return AgroalDataSource.from(supplier);
        } catch (SQLException | RuntimeException e) {
            log.warn("Failed to create warehouse pool: {}", ConnectionStrings.redact(jdbcUrl), e);
            throw new BackendUnavailableException("Failed to create warehouse pool for "
                    + ConnectionStrings.redact(jdbcUrl), e);
        }
    }

    /**
     * 当前缓存的池数量
     */
    public int size() {
        return pools.size();
    }

    public int getCreateCount() {
        return createCount.get();
    }

    @Shutdown
    void shutdown() {
        log.info("Closing {} warehouse pools", pools.size());
        pools.forEach((url, pool) -> {
            try {
                pool.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close warehouse pool: {}", ConnectionStrings.redact(url), e);
            }
        });
        pools.clear();
    }
}
