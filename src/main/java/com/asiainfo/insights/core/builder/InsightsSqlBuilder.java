package com.asiainfo.insights.core.builder;

import com.asiainfo.insights.core.InsightsConstants;
import com.asiainfo.insights.core.model.InsightsQuery;
import com.asiainfo.insights.core.model.SqlFragment;
import com.asiainfo.insights.core.model.SqlRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 聚合语句构建器。每种物理 schema 一个实现，每个请求新建一个实例。
 * <p>
 * 生成的语句形如
 * <pre>
 * SELECT &lt;bucket&gt; AS "date", &lt;metrics&gt;, &lt;groups&gt;
 * FROM ... WHERE ... GROUP BY 1, &lt;group positions&gt; ORDER BY 1
 * </pre>
 */
public interface InsightsSqlBuilder {

    InsightsQuery query();

    /**
     * One aggregate column per metric, aliased by metric name.
     */
    List<SqlFragment> buildSelectClause();

    /**
     * One column per raw group or per custom group entry, aliased by the group alias encoding.
     */
    List<SqlFragment> buildGroupSelectClause();

    /**
     * Conjuncts: time range, scope, metric event disjunction, filters.
     */
    List<SqlFragment> buildWhereClause();

    /**
     * Bucket label expression, without alias.
     */
    SqlFragment buildDateClause();

    /**
     * Tables and joins of the aggregation statement.
     */
    SqlFragment buildFromClause();

    /**
     * Source of raw event listing: the event table alone.
     */
    SqlFragment buildListingFromClause();

    CursorColumn cursorColumn();

    /**
     * Runs a statement against the resolved connection.
     */
    List<Map<String, Object>> execute(SqlRequest statement);

    default SqlRequest build() {
        List<SqlFragment> metricColumns = buildSelectClause();
        List<SqlFragment> groupColumns = buildGroupSelectClause();

        List<SqlFragment> columns = new ArrayList<>();
        columns.add(buildDateClause().append(" AS \"" + InsightsConstants.DATE_COLUMN + "\""));
        columns.addAll(metricColumns);
        columns.addAll(groupColumns);

        SqlFragment statement = SqlFragment.join(columns, ", ", "SELECT ", " FROM ")
                .append(buildFromClause());

        List<SqlFragment> where = buildWhereClause();
        if (!where.isEmpty()) {
            statement = statement.append(SqlFragment.join(where, " AND ", " WHERE ", ""));
        }

        // date is column 1, group columns follow the metric columns
        StringBuilder groupBy = new StringBuilder(" GROUP BY 1");
        int firstGroupPosition = 2 + metricColumns.size();
        for (int i = 0; i < groupColumns.size(); i++) {
            groupBy.append(", ").append(firstGroupPosition + i);
        }
        return SqlRequest.of(statement.append(groupBy.toString()).append(" ORDER BY 1"));
    }
}
