package com.asiainfo.insights.core.generator;

import com.asiainfo.insights.core.model.DateEncoding;
import com.asiainfo.insights.core.model.DateUnit;
import com.asiainfo.insights.core.model.SqlFragment;

import java.time.ZoneId;

/**
 * DuckDB: epoch_ms/strptime 返回不带时区的 TIMESTAMP，按 UTC 解释；
 * 非 UTC 时区才需要 ICU 的 timezone() 换算
 */
public final class DuckDbDialect implements SqlDialect {

    public static final DuckDbDialect INSTANCE = new DuckDbDialect();

    private DuckDbDialect() {}

    @Override
    public String name() {
        return "duckdb";
    }

    @Override
    public String toUtcTimestamp(String columnExpr, DateEncoding encoding) {
        return switch (encoding) {
            case TIMESTAMP -> "epoch_ms(CAST(" + columnExpr + " AS BIGINT) * 1000)";
            case TIMESTAMP_MS -> "epoch_ms(CAST(" + columnExpr + " AS BIGINT))";
            case DATE -> "strptime(CAST(" + columnExpr + " AS VARCHAR), '%Y-%m-%d')";
            case DATETIME -> "strptime(CAST(" + columnExpr + " AS VARCHAR), '%Y-%m-%d %H:%M:%S')";
        };
    }

    @Override
    public SqlFragment toZone(String utcTimestampExpr, ZoneId zone) {
        if (SqlDialect.isUtc(zone)) {
            return SqlFragment.raw(utcTimestampExpr);
        }
        return SqlFragment.of("timezone(?, timezone('UTC', " + utcTimestampExpr + "))", zone.getId());
    }

    @Override
    public String formatBucket(String timestampExpr, DateUnit unit) {
        return "strftime(" + timestampExpr + ", '" + pattern(unit) + "')";
    }

    @Override
    public String formatDateColumn(String dateColumnExpr, DateUnit unit) {
        return "strftime(CAST(" + dateColumnExpr + " AS DATE), '" + pattern(unit) + "')";
    }

    private static String pattern(DateUnit unit) {
        return switch (unit) {
            case MINUTE -> "%Y-%m-%d %H:%M:00";
            case HOUR -> "%Y-%m-%d %H:00:00";
            case DAY -> "%Y-%m-%d";
            case MONTH -> "%Y-%m-01";
            case YEAR -> "%Y-01-01";
        };
    }
}
