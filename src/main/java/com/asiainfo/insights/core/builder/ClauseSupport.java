package com.asiainfo.insights.core.builder;

import com.asiainfo.insights.core.InsightsConstants;
import com.asiainfo.insights.core.exception.InvalidQueryException;
import com.asiainfo.insights.core.generator.FilterOperatorCompiler;
import com.asiainfo.insights.core.generator.GroupAlias;
import com.asiainfo.insights.core.generator.SafeIdentifier;
import com.asiainfo.insights.core.model.CustomGroup;
import com.asiainfo.insights.core.model.DateEncoding;
import com.asiainfo.insights.core.model.FilterOperator;
import com.asiainfo.insights.core.model.FilterValueType;
import com.asiainfo.insights.core.model.GroupInfo;
import com.asiainfo.insights.core.model.InsightsQuery;
import com.asiainfo.insights.core.model.MetricInfo;
import com.asiainfo.insights.core.model.SqlFragment;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * 三种构建器共用的子句拼装
 */
final class ClauseSupport {

    private ClauseSupport() {}

    /**
     * Rejects metric and group names that would collide in the result set.
     */
    static void checkQuery(InsightsQuery query) {
        Set<String> metricNames = new HashSet<>();
        for (MetricInfo metric : query.metrics()) {
            if (metric == null || metric.math() == null) {
                throw new InvalidQueryException("metric requires name and math");
            }
            SafeIdentifier.of(metric.name());
            if (InsightsConstants.DATE_COLUMN.equals(metric.name())) {
                throw new InvalidQueryException("metric name is reserved: " + metric.name());
            }
            if (!metricNames.add(metric.name())) {
                throw new InvalidQueryException("duplicate metric: " + metric.name());
            }
        }
        Set<String> groupValues = new HashSet<>();
        for (GroupInfo group : query.groups()) {
            if (group == null || !groupValues.add(group.value())) {
                throw new InvalidQueryException("duplicate or empty group: " + (group == null ? null : group.value()));
            }
        }
        for (var filter : query.filters()) {
            if (filter == null || filter.name() == null) {
                throw new InvalidQueryException("filter requires a name");
            }
        }
    }

    static SqlFragment metricColumn(MetricInfo metric, SqlFragment eventPredicate, String distinctExpr) {
        SqlFragment aggregate = switch (metric.math()) {
            case EVENTS -> metric.isAllEvent()
                    ? SqlFragment.raw("count(1)")
                    : eventPredicate.wrap("sum(CASE WHEN ", " THEN 1 ELSE 0 END)");
            case SESSIONS -> {
                if (distinctExpr == null) {
                    throw new InvalidQueryException("session metrics need a distinct field: " + metric.name());
                }
                yield metric.isAllEvent()
                        ? SqlFragment.raw("count(DISTINCT " + distinctExpr + ")")
                        : eventPredicate.wrap("count(DISTINCT CASE WHEN ", " THEN " + distinctExpr + " END)");
            }
        };
        return aggregate.append(" AS " + SafeIdentifier.of(metric.name()).quoted());
    }

    /**
     * A row qualifies if it matches any requested metric; unconditional with the all-event sentinel.
     */
    static Optional<SqlFragment> eventDisjunction(List<MetricInfo> metrics,
                                                  Function<MetricInfo, SqlFragment> eventPredicate) {
        if (metrics.isEmpty()) {
            return Optional.empty();
        }
        if (metrics.stream().anyMatch(MetricInfo::isAllEvent)) {
            return Optional.of(SqlFragment.raw("1 = 1"));
        }
        List<SqlFragment> predicates = new ArrayList<>();
        for (MetricInfo metric : metrics) {
            predicates.add(eventPredicate.apply(metric));
        }
        return Optional.of(SqlFragment.join(predicates, " OR ", "(", ")"));
    }

    /**
     * Projection of one group over {@code columnExpr}: the raw value, or one 0/1 column per custom entry.
     */
    static List<SqlFragment> groupColumns(GroupInfo group, String columnExpr, DateEncoding dateEncoding, ZoneId zone) {
        List<SqlFragment> columns = new ArrayList<>();
        if (!group.hasCustomGroups()) {
            columns.add(SqlFragment.raw(columnExpr + " AS " + GroupAlias.raw(group.value()).quoted()));
            return columns;
        }
        FilterValueType type = group.type() == null ? FilterValueType.OTHER : group.type();
        Set<String> aliases = new HashSet<>();
        for (CustomGroup entry : group.customGroups()) {
            FilterOperator operator = FilterOperator.resolve(entry.filterOperator(), type);
            GroupAlias alias = GroupAlias.custom(group.value(), operator, entry.filterValue());
            if (!aliases.add(alias.encode())) {
                throw new InvalidQueryException("duplicate custom group: " + alias.label());
            }
            columns.add(FilterOperatorCompiler.project(type, entry.filterOperator(), entry.filterValue(),
                            columnExpr, dateEncoding, zone)
                    .append(" AS " + alias.quoted()));
        }
        return columns;
    }
}
