package com.asiainfo.insights.infra.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.ConfigProvider;

import java.util.Optional;

/**
 * 洞察查询配置。每次读取都走 ConfigProvider，配置源刷新后无需重启
 */
@ApplicationScoped
public class InsightsConfig {

    /**
     * 是否启用外部数仓
     */
    public boolean isWarehouseEnabled() {
        return ConfigProvider.getConfig()
                .getOptionalValue("insights.warehouse.enable", Boolean.class)
                .orElse(false);
    }

    /**
     * 共享数仓 JDBC url，应用未配置 databaseUrl 时使用
     */
    public Optional<String> getWarehouseUrl() {
        return ConfigProvider.getConfig()
                .getOptionalValue("insights.warehouse.url", String.class)
                .filter(url -> !url.isBlank());
    }

    public Optional<String> getWarehouseUsername() {
        return ConfigProvider.getConfig().getOptionalValue("insights.warehouse.username", String.class);
    }

    public Optional<String> getWarehousePassword() {
        return ConfigProvider.getConfig().getOptionalValue("insights.warehouse.password", String.class);
    }

    /**
     * 数仓应用定义 (JSON 数组)
     */
    public String getApplicationsJson() {
        return ConfigProvider.getConfig()
                .getOptionalValue("insights.warehouse.applications-json", String.class)
                .orElse("[]");
    }

    public int getPoolMaxSize() {
        return ConfigProvider.getConfig()
                .getOptionalValue("insights.warehouse.pool.max-size", Integer.class)
                .orElse(10);
    }

    public int getPoolAcquisitionTimeoutSeconds() {
        return ConfigProvider.getConfig()
                .getOptionalValue("insights.warehouse.pool.acquisition-timeout-seconds", Integer.class)
                .orElse(10);
    }

    /**
     * 内置事件库方言：duckdb 或 mysql
     */
    public String getInternalDialect() {
        return ConfigProvider.getConfig()
                .getOptionalValue("insights.internal.dialect", String.class)
                .orElse("duckdb");
    }

    /**
     * 事件明细分页的单页上限
     */
    public int getEventsMaxLimit() {
        return ConfigProvider.getConfig()
                .getOptionalValue("insights.events.max-limit", Integer.class)
                .orElse(100);
    }
}
