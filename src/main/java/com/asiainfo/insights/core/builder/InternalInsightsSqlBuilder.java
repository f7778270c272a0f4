package com.asiainfo.insights.core.builder;

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
import com.asiainfo.insights.core.schema.InternalSchema;
import com.asiainfo.insights.infra.persistence.ResolvedInsight;
import com.asiainfo.insights.infra.persistence.StatementExecutor;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 内置事件库 (website_event 长格式表)。insightId 对应 website_id
 */
public class InternalInsightsSqlBuilder implements InsightsSqlBuilder {

    private static final String TABLE = SafeIdentifier.of(InternalSchema.TABLE).quoted();
    private static final String EVENT_NAME = SafeIdentifier.of(InternalSchema.EVENT_NAME).quoted();
    private static final String SESSION_ID = SafeIdentifier.of(InternalSchema.SESSION_ID).quoted();
    private static final String WEBSITE_ID = SafeIdentifier.of(InternalSchema.WEBSITE_ID).quoted();
    private static final TimeColumn CREATED_AT = new TimeColumn(
            SafeIdentifier.of(InternalSchema.CREATED_AT).quoted(), InternalSchema.CREATED_AT_ENCODING, null);

    private final InsightsQuery query;
    private final ResolvedInsight target;
    private final StatementExecutor executor;
    private final ZoneId zone;

    public InternalInsightsSqlBuilder(InsightsQuery query, InsightsContext context,
                                      ResolvedInsight target, StatementExecutor executor) {
        ClauseSupport.checkQuery(query);
        this.query = query;
        this.target = target;
        this.executor = executor;
        this.zone = query.time().zone(context);
    }

    @Override
    public InsightsQuery query() {
        return query;
    }

    @Override
    public List<SqlFragment> buildSelectClause() {
        List<SqlFragment> columns = new ArrayList<>();
        for (MetricInfo metric : query.metrics()) {
            columns.add(ClauseSupport.metricColumn(metric, eventPredicate(metric), SESSION_ID));
        }
        return columns;
    }

    @Override
    public List<SqlFragment> buildGroupSelectClause() {
        List<SqlFragment> columns = new ArrayList<>();
        for (GroupInfo group : query.groups()) {
            columns.addAll(ClauseSupport.groupColumns(group, column(group.value()),
                    encodingOf(group.value()), zone));
        }
        return columns;
    }

    @Override
    public List<SqlFragment> buildWhereClause() {
        List<SqlFragment> where = new ArrayList<>();
        where.add(DateBucketCompiler.rangePredicate(CREATED_AT, query.time(), zone));
        where.add(SqlFragment.of(WEBSITE_ID + " = ?", query.insightId()));
        ClauseSupport.eventDisjunction(query.metrics(), this::eventPredicate).ifPresent(where::add);
        for (FilterInfo filter : query.filters()) {
            where.add(FilterOperatorCompiler.compile(filter.type(), filter.operator(), filter.value(),
                    column(filter.name()), encodingOf(filter.name()), zone));
        }
        return where;
    }

    @Override
    public SqlFragment buildDateClause() {
        return DateBucketCompiler.bucket(CREATED_AT, query.time(), zone, target.dialect());
    }

    @Override
    public SqlFragment buildFromClause() {
        return SqlFragment.raw(TABLE);
    }

    @Override
    public SqlFragment buildListingFromClause() {
        return SqlFragment.raw(TABLE);
    }

    @Override
    public CursorColumn cursorColumn() {
        return new CursorColumn(SafeIdentifier.of(InternalSchema.ID).quoted(), InternalSchema.ID);
    }

    @Override
    public List<Map<String, Object>> execute(SqlRequest statement) {
        return executor.execute(target, query.insightId(), statement);
    }

    private SqlFragment eventPredicate(MetricInfo metric) {
        return SqlFragment.of(EVENT_NAME + " = ?", metric.name());
    }

    private static String column(String name) {
        return InternalSchema.column(name).quoted();
    }

    private static DateEncoding encodingOf(String name) {
        return InternalSchema.CREATED_AT.equals(name) ? InternalSchema.CREATED_AT_ENCODING : DateEncoding.DATETIME;
    }
}
