package com.asiainfo.insights.core.builder;

import com.asiainfo.insights.core.exception.ApplicationConfigInvalidException;
import com.asiainfo.insights.core.exception.InvalidQueryException;
import com.asiainfo.insights.core.generator.DateBucketCompiler;
import com.asiainfo.insights.core.generator.FilterOperatorCompiler;
import com.asiainfo.insights.core.generator.SafeIdentifier;
import com.asiainfo.insights.core.generator.TimeColumn;
import com.asiainfo.insights.core.model.DateEncoding;
import com.asiainfo.insights.core.model.FilterInfo;
import com.asiainfo.insights.core.model.GroupInfo;
import com.asiainfo.insights.core.model.InsightsContext;
import com.asiainfo.insights.core.model.InsightsQuery;
import com.asiainfo.insights.core.model.MetricInfo;
import com.asiainfo.insights.core.model.SqlFragment;
import com.asiainfo.insights.core.model.SqlRequest;
import com.asiainfo.insights.core.schema.WideTableApplication;
import com.asiainfo.insights.core.schema.WideTableField;
import com.asiainfo.insights.infra.persistence.ResolvedInsight;
import com.asiainfo.insights.infra.persistence.StatementExecutor;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 宽表：指标名即列名，某行该列非空即视为发生了该事件
 */
public class WarehouseWideTableInsightsSqlBuilder implements InsightsSqlBuilder {

    private final InsightsQuery query;
    private final ResolvedInsight target;
    private final StatementExecutor executor;
    private final WideTableApplication application;
    private final ZoneId zone;
    private final TimeColumn createdAt;

    public WarehouseWideTableInsightsSqlBuilder(InsightsQuery query, InsightsContext context,
                                                ResolvedInsight target, StatementExecutor executor) {
        ClauseSupport.checkQuery(query);
        this.query = query;
        this.target = target;
        this.executor = executor;
        this.application = (WideTableApplication) target.application();
        this.zone = query.time().zone(context);
        this.createdAt = new TimeColumn(
                SafeIdentifier.of(application.createdAtField()).quoted(),
                application.createdAtFieldType(),
                application.dateBasedCreatedAtField() == null
                        ? null : SafeIdentifier.of(application.dateBasedCreatedAtField()).quoted());
    }

    @Override
    public InsightsQuery query() {
        return query;
    }

    @Override
    public List<SqlFragment> buildSelectClause() {
        String distinct = application.distinctField() == null
                ? null : SafeIdentifier.of(application.distinctField()).quoted();
        List<SqlFragment> columns = new ArrayList<>();
        for (MetricInfo metric : query.metrics()) {
            SqlFragment predicate = metric.isAllEvent() ? null : eventPredicate(metric);
            columns.add(ClauseSupport.metricColumn(metric, predicate, distinct));
        }
        return columns;
    }

    @Override
    public List<SqlFragment> buildGroupSelectClause() {
        List<SqlFragment> columns = new ArrayList<>();
        for (GroupInfo group : query.groups()) {
            columns.addAll(ClauseSupport.groupColumns(group, column(group.value()), encodingOf(group.value()), zone));
        }
        return columns;
    }

    @Override
    public List<SqlFragment> buildWhereClause() {
        List<SqlFragment> where = new ArrayList<>();
        where.add(DateBucketCompiler.rangePredicate(createdAt, query.time(), zone));
        ClauseSupport.eventDisjunction(query.metrics(), this::eventPredicate).ifPresent(where::add);
        for (FilterInfo filter : query.filters()) {
            where.add(FilterOperatorCompiler.compile(filter.type(), filter.operator(), filter.value(),
                    column(filter.name()), encodingOf(filter.name()), zone));
        }
        return where;
    }

    @Override
    public SqlFragment buildDateClause() {
        return DateBucketCompiler.bucket(createdAt, query.time(), zone, target.dialect());
    }

    @Override
    public SqlFragment buildFromClause() {
        return SqlFragment.raw(SafeIdentifier.table(application.tableName()).quoted());
    }

    @Override
    public SqlFragment buildListingFromClause() {
        return buildFromClause();
    }

    @Override
    public CursorColumn cursorColumn() {
        // 游标列必须唯一，时间列可能重复，翻页会漏行
        if (application.idField() == null) {
            throw new ApplicationConfigInvalidException("Application " + application.name()
                    + " needs idField to list events");
        }
        return new CursorColumn(SafeIdentifier.of(application.idField()).quoted(), application.idField());
    }

    @Override
    public List<Map<String, Object>> execute(SqlRequest statement) {
        return executor.execute(target, query.insightId(), statement);
    }

    private SqlFragment eventPredicate(MetricInfo metric) {
        return SqlFragment.raw(column(metric.name()) + " IS NOT NULL");
    }

    private String column(String name) {
        if (!application.isKnownColumn(name)) {
            throw new InvalidQueryException("Unknown field " + name + " in application " + application.name());
        }
        return SafeIdentifier.of(name).quoted();
    }

    private DateEncoding encodingOf(String name) {
        if (name.equals(application.createdAtField())) {
            return application.createdAtFieldType();
        }
        return application.field(name).map(WideTableField::dateEncoding).orElse(DateEncoding.DATETIME);
    }
}
