package com.asiainfo.insights.core.builder;

import com.asiainfo.insights.core.exception.ApplicationConfigInvalidException;
import com.asiainfo.insights.core.generator.DateBucketCompiler;
import com.asiainfo.insights.core.generator.FilterOperatorCompiler;
import com.asiainfo.insights.core.generator.SafeIdentifier;
import com.asiainfo.insights.core.generator.TimeColumn;
import com.asiainfo.insights.core.model.DateEncoding;
import com.asiainfo.insights.core.model.FilterInfo;
import com.asiainfo.insights.core.model.FilterOperator;
import com.asiainfo.insights.core.model.FilterValueType;
import com.asiainfo.insights.core.model.GroupInfo;
import com.asiainfo.insights.core.model.InsightsContext;
import com.asiainfo.insights.core.model.InsightsQuery;
import com.asiainfo.insights.core.model.MetricInfo;
import com.asiainfo.insights.core.model.SqlFragment;
import com.asiainfo.insights.core.model.SqlRequest;
import com.asiainfo.insights.core.schema.EventParametersTableDef;
import com.asiainfo.insights.core.schema.EventTableDef;
import com.asiainfo.insights.core.schema.LongTableApplication;
import com.asiainfo.insights.infra.persistence.ResolvedInsight;
import com.asiainfo.insights.infra.persistence.StatementExecutor;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 长表：事件表 "e" + 参数表。
 * <ul>
 *   <li>参数过滤: 相关子查询 EXISTS (... 参数表 "fN" ...)</li>
 *   <li>参数分组: LEFT JOIN 参数表 "gN"，每个分组一次</li>
 *   <li>事件表自身的列 (事件名、distinct、时间) 直接引用</li>
 * </ul>
 */
public class WarehouseLongTableInsightsSqlBuilder implements InsightsSqlBuilder {

    private static final String EVENT_ALIAS = "e";

    private final InsightsQuery query;
    private final ResolvedInsight target;
    private final StatementExecutor executor;
    private final LongTableApplication application;
    private final EventTableDef events;
    private final EventParametersTableDef params;
    private final ZoneId zone;
    private final TimeColumn createdAt;

    public WarehouseLongTableInsightsSqlBuilder(InsightsQuery query, InsightsContext context,
                                                ResolvedInsight target, StatementExecutor executor) {
        ClauseSupport.checkQuery(query);
        this.query = query;
        this.target = target;
        this.executor = executor;
        this.application = (LongTableApplication) target.application();
        this.events = application.eventTable();
        this.params = application.eventParametersTable();
        this.zone = query.time().zone(context);
        this.createdAt = new TimeColumn(eventColumn(events.createdAtField()), events.createdAtFieldType(),
                events.dateBasedCreatedAtField() == null ? null : eventColumn(events.dateBasedCreatedAtField()));
    }

    @Override
    public InsightsQuery query() {
        return query;
    }

    @Override
    public List<SqlFragment> buildSelectClause() {
        String distinct = events.distinctField() == null ? null : eventColumn(events.distinctField());
        List<SqlFragment> columns = new ArrayList<>();
        for (MetricInfo metric : query.metrics()) {
            columns.add(ClauseSupport.metricColumn(metric, eventPredicate(metric), distinct));
        }
        return columns;
    }

    @Override
    public List<SqlFragment> buildGroupSelectClause() {
        List<SqlFragment> columns = new ArrayList<>();
        for (int i = 0; i < query.groups().size(); i++) {
            GroupInfo group = query.groups().get(i);
            if (isEventColumn(group.value())) {
                columns.addAll(ClauseSupport.groupColumns(group, eventColumn(group.value()),
                        eventEncodingOf(group.value()), zone));
            } else {
                String valueColumn = paramValueColumn(groupAlias(i), group.type());
                columns.addAll(ClauseSupport.groupColumns(group, valueColumn,
                        paramEncodingOf(group.type()), zone));
            }
        }
        return columns;
    }

    @Override
    public List<SqlFragment> buildWhereClause() {
        List<SqlFragment> where = new ArrayList<>();
        where.add(DateBucketCompiler.rangePredicate(createdAt, query.time(), zone));
        ClauseSupport.eventDisjunction(query.metrics(), this::eventPredicate).ifPresent(where::add);
        for (int i = 0; i < query.filters().size(); i++) {
            FilterInfo filter = query.filters().get(i);
            if (isEventColumn(filter.name())) {
                where.add(FilterOperatorCompiler.compile(filter.type(), filter.operator(), filter.value(),
                        eventColumn(filter.name()), eventEncodingOf(filter.name()), zone));
            } else {
                where.add(parameterFilter(filter, "f" + i));
            }
        }
        return where;
    }

    @Override
    public SqlFragment buildDateClause() {
        return DateBucketCompiler.bucket(createdAt, query.time(), zone, target.dialect());
    }

    @Override
    public SqlFragment buildFromClause() {
        SqlFragment from = buildListingFromClause();
        for (int i = 0; i < query.groups().size(); i++) {
            GroupInfo group = query.groups().get(i);
            if (!isEventColumn(group.value())) {
                from = from.append(parameterJoin(group, groupAlias(i)));
            }
        }
        return from;
    }

    @Override
    public SqlFragment buildListingFromClause() {
        return SqlFragment.raw(SafeIdentifier.table(events.name()).quoted() + " AS " + quotedAlias(EVENT_ALIAS));
    }

    @Override
    public CursorColumn cursorColumn() {
        // 游标列必须唯一，时间列可能重复，翻页会漏行
        if (events.idField() == null) {
            throw new ApplicationConfigInvalidException("Application " + application.name()
                    + " needs eventTable.idField to list events");
        }
        return new CursorColumn(eventColumn(events.idField()), events.idField());
    }

    @Override
    public List<Map<String, Object>> execute(SqlRequest statement) {
        return executor.execute(target, query.insightId(), statement);
    }

    private SqlFragment eventPredicate(MetricInfo metric) {
        return SqlFragment.of(eventColumn(events.eventNameField()) + " = ?", metric.name());
    }

    /**
     * EXISTS over the parameter rows of the current event; a null check means the parameter has no value.
     */
    private SqlFragment parameterFilter(FilterInfo filter, String alias) {
        FilterValueType type = filter.type() == null ? FilterValueType.OTHER : filter.type();
        FilterOperator operator = FilterOperator.resolve(filter.operator(), type);
        String valueColumn = paramValueColumn(alias, type);

        SqlFragment predicate;
        String quantifier = "EXISTS";
        if (operator == FilterOperator.IS_NULL) {
            quantifier = "NOT EXISTS";
            predicate = SqlFragment.raw(valueColumn + " IS NOT NULL");
        } else {
            predicate = FilterOperatorCompiler.compile(type, filter.operator(), filter.value(), valueColumn,
                    paramEncodingOf(type), zone);
        }

        SqlFragment subquery = SqlFragment.raw(quantifier + " (SELECT 1 FROM "
                        + SafeIdentifier.table(params.name()).quoted() + " AS " + quotedAlias(alias) + " WHERE ")
                .append(parameterMatch(alias, filter.name()))
                .append(" AND ")
                .append(DateBucketCompiler.rangePredicate(paramTimeColumn(alias), query.time(), zone))
                .append(" AND ")
                .append(predicate);
        return subquery.append(")");
    }

    private SqlFragment parameterJoin(GroupInfo group, String alias) {
        return SqlFragment.raw(" LEFT JOIN " + SafeIdentifier.table(params.name()).quoted()
                        + " AS " + quotedAlias(alias) + " ON ")
                .append(parameterMatch(alias, group.value()))
                .append(" AND ")
                .append(DateBucketCompiler.rangePredicate(paramTimeColumn(alias), query.time(), zone));
    }

    /**
     * {@code "p"."event_id" = "e"."id" AND "p"."name" = ?}
     */
    private SqlFragment parameterMatch(String alias, String parameterName) {
        if (events.idField() == null || params.eventIdField() == null) {
            throw new ApplicationConfigInvalidException("Application " + application.name()
                    + " needs eventTable.idField and eventParametersTable.eventIdField for parameter "
                    + parameterName);
        }
        String eventId = SafeIdentifier.of(params.eventIdField()).qualifiedBy(alias);
        String name = SafeIdentifier.of(params.paramsNameField()).qualifiedBy(alias);
        return SqlFragment.of(eventId + " = " + eventColumn(events.idField()) + " AND " + name + " = ?",
                SafeIdentifier.of(parameterName).name());
    }

    private TimeColumn paramTimeColumn(String alias) {
        return new TimeColumn(SafeIdentifier.of(params.createdAtField()).qualifiedBy(alias),
                params.createdAtFieldType(),
                params.dateBasedCreatedAtField() == null
                        ? null : SafeIdentifier.of(params.dateBasedCreatedAtField()).qualifiedBy(alias));
    }

    private String paramValueColumn(String alias, FilterValueType type) {
        return SafeIdentifier.of(params.valueFieldFor(type)).qualifiedBy(alias);
    }

    private DateEncoding paramEncodingOf(FilterValueType type) {
        return type == FilterValueType.DATE ? params.dateValueEncoding() : DateEncoding.DATETIME;
    }

    private boolean isEventColumn(String name) {
        return name != null && (name.equals(events.eventNameField())
                || name.equals(events.createdAtField())
                || name.equals(events.distinctField())
                || name.equals(events.idField()));
    }

    private DateEncoding eventEncodingOf(String name) {
        return name.equals(events.createdAtField()) ? events.createdAtFieldType() : DateEncoding.DATETIME;
    }

    private String eventColumn(String name) {
        return SafeIdentifier.of(name).qualifiedBy(EVENT_ALIAS);
    }

    private static String groupAlias(int index) {
        return "g" + index;
    }

    private static String quotedAlias(String alias) {
        return SafeIdentifier.of(alias).quoted();
    }
}
