package com.asiainfo.insights.core.engine;

import com.asiainfo.insights.core.builder.CursorColumn;
import com.asiainfo.insights.core.exception.InvalidQueryException;
import com.asiainfo.insights.core.model.EventPage;
import com.asiainfo.insights.core.model.SortOrder;
import com.asiainfo.insights.core.model.SqlFragment;
import com.asiainfo.insights.core.model.SqlRequest;
import com.asiainfo.insights.infra.persistence.ResolvedInsight;
import com.asiainfo.insights.infra.persistence.StatementExecutor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 游标分页。多取一行判断是否还有下一页，游标为本页最后一行的游标列值
 */
@ApplicationScoped
public class EventLogPaginator {

    private static final Logger log = LoggerFactory.getLogger(EventLogPaginator.class);

    private static final Pattern NUMERIC_CURSOR = Pattern.compile("-?\\d{1,18}");

    @Inject
    StatementExecutor executor;

    public EventPage page(ResolvedInsight target, String insightId, SqlFragment source, List<SqlFragment> where,
                          int limit, String cursor, CursorColumn cursorColumn, SortOrder order) {
        if (limit < 1) {
            throw new InvalidQueryException("limit must be at least 1, got " + limit);
        }
        SqlRequest statement = buildStatement(source, where, limit, cursor, cursorColumn, order);
        List<Map<String, Object>> rows = executor.execute(target, insightId, statement);

        if (rows.size() <= limit) {
            return new EventPage(rows, null);
        }
        List<Map<String, Object>> items = new ArrayList<>(rows.subList(0, limit));
        Object last = items.get(items.size() - 1).get(cursorColumn.label());
        if (last == null) {
            log.warn("Cursor column {} is null for insight {}, paging stops here", cursorColumn.label(), insightId);
            return new EventPage(items, null);
        }
        return new EventPage(items, String.valueOf(last));
    }

    static SqlRequest buildStatement(SqlFragment source, List<SqlFragment> where, int limit, String cursor,
                                     CursorColumn cursorColumn, SortOrder order) {
        SortOrder direction = order == null ? SortOrder.DESC : order;
        List<SqlFragment> conditions = new ArrayList<>(where);
        if (cursor != null && !cursor.isEmpty()) {
            conditions.add(SqlFragment.of(cursorColumn.expr() + " " + direction.comparator() + " ?",
                    decodeCursor(cursor)));
        }
        SqlFragment statement = SqlFragment.raw("SELECT * FROM ").append(source);
        if (!conditions.isEmpty()) {
            statement = statement.append(SqlFragment.join(conditions, " AND ", " WHERE ", ""));
        }
        statement = statement
                .append(" ORDER BY " + cursorColumn.expr() + " " + direction.name())
                .append(SqlFragment.of(" LIMIT ?", limit + 1));
        return SqlRequest.of(statement);
    }

    static Object decodeCursor(String cursor) {
        if (NUMERIC_CURSOR.matcher(cursor).matches()) {
            return Long.parseLong(cursor);
        }
        return cursor;
    }
}
