package com.asiainfo.insights.core.generator;

import com.asiainfo.insights.core.exception.ApplicationConfigInvalidException;
import com.asiainfo.insights.core.model.DateEncoding;
import com.asiainfo.insights.core.model.DateUnit;
import com.asiainfo.insights.core.model.SqlFragment;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 存储引擎方言。构建器只产出双引号标识符和 {@code ?} 占位符，
 * 方言负责时间换算、bucket 格式化以及执行前的引号转换
 */
public interface SqlDialect {

    String name();

    /**
     * Naive UTC timestamp expression of a time column stored with {@code encoding}.
     */
    String toUtcTimestamp(String columnExpr, DateEncoding encoding);

    /**
     * Shifts a naive UTC timestamp into the wall clock of {@code zone}; the zone id is bound.
     */
    SqlFragment toZone(String utcTimestampExpr, ZoneId zone);

    /**
     * Formats a timestamp expression into the bucket label of {@code unit}.
     */
    String formatBucket(String timestampExpr, DateUnit unit);

    /**
     * Formats a calendar-date column, already in the query zone, into the bucket label.
     */
    String formatDateColumn(String dateColumnExpr, DateUnit unit);

    /**
     * Statement text as the engine expects it.
     */
    default String translate(String sql) {
        return sql;
    }

    /**
     * Executed once on every new pooled connection, or null.
     */
    default String initSql() {
        return null;
    }

    static boolean isUtc(ZoneId zone) {
        return zone.normalized().equals(ZoneOffset.UTC);
    }

    static SqlDialect forJdbcUrl(String jdbcUrl) {
        if (jdbcUrl != null) {
            if (jdbcUrl.startsWith("jdbc:mysql:")) {
                return MySqlDialect.INSTANCE;
            }
            if (jdbcUrl.startsWith("jdbc:duckdb:")) {
                return DuckDbDialect.INSTANCE;
            }
        }
        throw new ApplicationConfigInvalidException("Unsupported warehouse driver: "
                + ConnectionStrings.scheme(jdbcUrl));
    }

    static SqlDialect forName(String name) {
        if ("mysql".equalsIgnoreCase(name)) {
            return MySqlDialect.INSTANCE;
        }
        if ("duckdb".equalsIgnoreCase(name)) {
            return DuckDbDialect.INSTANCE;
        }
        throw new ApplicationConfigInvalidException("Unsupported dialect: " + name);
    }
}
