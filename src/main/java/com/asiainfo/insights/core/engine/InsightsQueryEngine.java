package com.asiainfo.insights.core.engine;

import com.asiainfo.insights.core.builder.InsightsSqlBuilder;
import com.asiainfo.insights.core.builder.InsightsSqlBuilderFactory;
import com.asiainfo.insights.core.exception.InvalidQueryException;
import com.asiainfo.insights.core.model.EventPage;
import com.asiainfo.insights.core.model.EventsQuery;
import com.asiainfo.insights.core.model.InsightType;
import com.asiainfo.insights.core.model.InsightsContext;
import com.asiainfo.insights.core.model.InsightsQuery;
import com.asiainfo.insights.core.model.SqlRequest;
import com.asiainfo.insights.core.model.TimeSeries;
import com.asiainfo.insights.core.schema.WideTableApplication;
import com.asiainfo.insights.core.schema.WideTableField;
import com.asiainfo.insights.infra.config.InsightsConfig;
import com.asiainfo.insights.infra.persistence.ResolvedInsight;
import com.asiainfo.insights.infra.persistence.WarehouseApplicationRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * 洞察查询入口：解析目标 -> 构建语句 -> 执行 -> 重组结果
 */
@ApplicationScoped
public class InsightsQueryEngine {

    private static final Logger log = LoggerFactory.getLogger(InsightsQueryEngine.class);

    @Inject
    WarehouseApplicationRegistry registry;
    @Inject
    InsightsSqlBuilderFactory builderFactory;
    @Inject
    EventLogPaginator paginator;
    @Inject
    InsightsConfig config;

    public List<TimeSeries> query(InsightsQuery query, InsightsContext context) {
        long t0 = System.currentTimeMillis();
        ZoneId zone = query.time().zone(context);

        ResolvedInsight target = registry.resolve(query.insightId(), query.insightType());
        InsightsSqlBuilder builder = builderFactory.create(query, context, target);
        // 编译失败在此抛出，不会发送半成品语句
        SqlRequest statement = builder.build();
        log.debug("[{}] insight {}: {} {}", query.insightType().wireName(), query.insightId(),
                statement.sql(), statement.params());

        List<Map<String, Object>> rows = builder.execute(statement);
        List<TimeSeries> series = InsightsResultReshaper.reshape(query, zone, rows);
        log.info("[{}] insight {}: {} rows -> {} series in {}ms", query.insightType().wireName(),
                query.insightId(), rows.size(), series.size(), System.currentTimeMillis() - t0);
        return series;
    }

    public EventPage queryEvents(EventsQuery query, InsightsContext context) {
        int maxLimit = config.getEventsMaxLimit();
        if (query.limit() > maxLimit) {
            throw new InvalidQueryException("limit " + query.limit() + " exceeds maximum " + maxLimit);
        }
        ResolvedInsight target = registry.resolve(query.insightId(), query.insightType());
        InsightsSqlBuilder builder = builderFactory.create(query.toInsightsQuery(), context, target);
        EventPage page = paginator.page(target, query.insightId(), builder.buildListingFromClause(),
                builder.buildWhereClause(), query.limit(), query.cursor(), builder.cursorColumn(), query.order());
        log.debug("[{}] insight {}: {} events, more={}", query.insightType().wireName(), query.insightId(),
                page.items().size(), page.hasMore());
        return page;
    }

    /**
     * 宽表应用声明的字段，供前端选择指标/分组
     */
    public List<WideTableField> listFields(String insightId) {
        WideTableApplication application = (WideTableApplication) registry.findApplication(insightId,
                InsightType.WAREHOUSE_WIDE);
        return application.fields();
    }
}
