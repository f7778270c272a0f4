package com.asiainfo.insights.infra.persistence;

import com.asiainfo.insights.core.exception.ApplicationConfigInvalidException;
import com.asiainfo.insights.core.exception.ApplicationNotFoundException;
import com.asiainfo.insights.core.exception.BackendUnavailableException;
import com.asiainfo.insights.core.exception.InsightsException;
import com.asiainfo.insights.core.generator.SqlDialect;
import com.asiainfo.insights.core.model.InsightType;
import com.asiainfo.insights.core.schema.WarehouseApplication;
import com.asiainfo.insights.infra.config.InsightsConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 数仓应用注册表。
 * <p>
 * 应用定义来自 insights.warehouse.applications-json，首次使用时解析一次并缓存，
 * {@link #reload()} 后下次访问重新解析。解析失败不缓存
 */
@ApplicationScoped
public class WarehouseApplicationRegistry {

    private static final Logger log = LoggerFactory.getLogger(WarehouseApplicationRegistry.class);

    @Inject
    InsightsConfig config;
    @Inject
    ObjectMapper objectMapper;
    @Inject
    WarehouseConnectionPools pools;
    @Inject
    AgroalDataSource internalDataSource;

    private volatile List<WarehouseApplication> applications;
    private final Object parseLock = new Object();

    /**
     * 获取全部应用定义 (解析一次)
     */
    public List<WarehouseApplication> getApplications() {
        List<WarehouseApplication> current = applications;
        if (current != null) {
            return current;
        }
        synchronized (parseLock) {
            if (applications == null) {
                applications = parse(config.getApplicationsJson());
            }
            return applications;
        }
    }

    /**
     * 丢弃已解析的定义
     */
    public void reload() {
        synchronized (parseLock) {
            applications = null;
        }
        log.info("Warehouse application definitions will be re-parsed on next use");
    }

    public WarehouseApplication findApplication(String name, InsightType type) {
        return getApplications().stream()
                .filter(app -> app.name().equals(name) && app.insightType() == type)
                .findFirst()
                .orElseThrow(() -> new ApplicationNotFoundException(name, type));
    }

    /**
     * 解析查询目标：内置库直接使用默认数据源；数仓应用按连接串取池
     */
    public ResolvedInsight resolve(String insightId, InsightType type) {
        if (type == InsightType.INTERNAL) {
            return new ResolvedInsight(type, null, internalDataSource,
                    SqlDialect.forName(config.getInternalDialect()));
        }
        if (!config.isWarehouseEnabled()) {
            throw new BackendUnavailableException("Warehouse is not enabled");
        }
        WarehouseApplication application = findApplication(insightId, type);
        String url = application.databaseUrl() != null && !application.databaseUrl().isBlank()
                ? application.databaseUrl()
                : config.getWarehouseUrl().orElseThrow(
                        () -> new BackendUnavailableException("No warehouse url configured for " + insightId));
        SqlDialect dialect = SqlDialect.forJdbcUrl(url);
        return new ResolvedInsight(type, application, pools.getOrCreate(url, dialect), dialect);
    }

    private List<WarehouseApplication> parse(String json) {
        List<WarehouseApplication> parsed;
        try {
            parsed = objectMapper.readValue(json, new TypeReference<List<WarehouseApplication>>() {
            });
        } catch (JsonProcessingException e) {
            log.error("Failed to parse warehouse application definitions: {}", e.getOriginalMessage());
            throw new ApplicationConfigInvalidException(
                    "Invalid warehouse application definitions: " + e.getOriginalMessage(), e);
        }
        if (parsed == null) {
            throw new ApplicationConfigInvalidException("Warehouse application definitions must be a JSON array");
        }

        Set<String> seen = new HashSet<>();
        for (WarehouseApplication app : parsed) {
            if (app == null) {
                throw new ApplicationConfigInvalidException("Null warehouse application definition");
            }
            try {
                app.validate();
            } catch (ApplicationConfigInvalidException e) {
                throw e;
            } catch (InsightsException | IllegalArgumentException e) {
                throw new ApplicationConfigInvalidException(e.getMessage(), e);
            }
            if (!seen.add(app.insightType().wireName() + "/" + app.name())) {
                throw new ApplicationConfigInvalidException("Duplicate warehouse application: " + app.name());
            }
        }
        log.info("Loaded {} warehouse applications", parsed.size());
        return List.copyOf(parsed);
    }
}
