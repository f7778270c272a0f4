package com.asiainfo.insights.core.generator;

import com.asiainfo.insights.core.model.DateEncoding;
import com.asiainfo.insights.core.model.DateUnit;
import com.asiainfo.insights.core.model.SqlFragment;

import java.time.ZoneId;

/**
 * MySQL: 会话时区固定为 UTC，FROM_UNIXTIME 因此返回 UTC 时间
 */
public final class MySqlDialect implements SqlDialect {

    public static final MySqlDialect INSTANCE = new MySqlDialect();

    private MySqlDialect() {}

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public String toUtcTimestamp(String columnExpr, DateEncoding encoding) {
        return switch (encoding) {
            case TIMESTAMP -> "FROM_UNIXTIME(" + columnExpr + ")";
            case TIMESTAMP_MS -> "FROM_UNIXTIME(" + columnExpr + " / 1000)";
            case DATE -> "STR_TO_DATE(" + columnExpr + ", '%Y-%m-%d')";
            case DATETIME -> "STR_TO_DATE(" + columnExpr + ", '%Y-%m-%d %H:%i:%s')";
        };
    }

    @Override
    public SqlFragment toZone(String utcTimestampExpr, ZoneId zone) {
        if (SqlDialect.isUtc(zone)) {
            return SqlFragment.raw(utcTimestampExpr);
        }
        return SqlFragment.of("CONVERT_TZ(" + utcTimestampExpr + ", '+00:00', ?)", zone.getId());
    }

    @Override
    public String formatBucket(String timestampExpr, DateUnit unit) {
        return "DATE_FORMAT(" + timestampExpr + ", '" + pattern(unit) + "')";
    }

    @Override
    public String formatDateColumn(String dateColumnExpr, DateUnit unit) {
        return formatBucket(dateColumnExpr, unit);
    }

    @Override
    public String translate(String sql) {
        // builders never emit quote characters inside literals, all values are bound
        return sql.replace('"', '`');
    }

    @Override
    public String initSql() {
        return "SET time_zone = '+00:00'";
    }

    private static String pattern(DateUnit unit) {
        return switch (unit) {
            case MINUTE -> "%Y-%m-%d %H:%i:00";
            case HOUR -> "%Y-%m-%d %H:00:00";
            case DAY -> "%Y-%m-%d";
            case MONTH -> "%Y-%m-01";
            case YEAR -> "%Y-01-01";
        };
    }
}
