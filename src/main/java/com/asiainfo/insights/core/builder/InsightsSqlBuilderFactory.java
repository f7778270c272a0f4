package com.asiainfo.insights.core.builder;

import com.asiainfo.insights.core.model.InsightsContext;
import com.asiainfo.insights.core.model.InsightsQuery;
import com.asiainfo.insights.infra.persistence.ResolvedInsight;
import com.asiainfo.insights.infra.persistence.StatementExecutor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 按洞察类型选择构建器
 */
@ApplicationScoped
public class InsightsSqlBuilderFactory {

    private static final Logger log = LoggerFactory.getLogger(InsightsSqlBuilderFactory.class);

    @Inject
    StatementExecutor executor;

    public InsightsSqlBuilder create(InsightsQuery query, InsightsContext context, ResolvedInsight target) {
        log.debug("Building {} statement for insight {}", target.type().wireName(), query.insightId());
        return switch (target.type()) {
            case INTERNAL -> new InternalInsightsSqlBuilder(query, context, target, executor);
            case WAREHOUSE_LONG -> new WarehouseLongTableInsightsSqlBuilder(query, context, target, executor);
            case WAREHOUSE_WIDE -> new WarehouseWideTableInsightsSqlBuilder(query, context, target, executor);
        };
    }
}
