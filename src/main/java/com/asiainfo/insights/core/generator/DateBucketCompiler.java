package com.asiainfo.insights.core.generator;

import com.asiainfo.insights.core.exception.InvalidTimeUnitException;
import com.asiainfo.insights.core.model.DateEncoding;
import com.asiainfo.insights.core.model.DateUnit;
import com.asiainfo.insights.core.model.SqlFragment;
import com.asiainfo.insights.core.model.TimeWindow;

import java.time.Instant;
import java.time.ZoneId;

/**
 * 时间分桶与时间范围谓词。
 * <p>
 * 当表声明了按天存储的日期列、窗口跨度不少于一天且粒度不小于天时，
 * 分桶和范围过滤改走日期列，便于引擎做分区裁剪
 */
public final class DateBucketCompiler {

    private DateBucketCompiler() {}

    /**
     * Whether bucketing and range filtering may use the calendar-date column.
     */
    public static boolean useDateColumn(TimeColumn column, TimeWindow window) {
        return column.hasDateBasedColumn()
                && window.spansAtLeastOneDay()
                && window.unit() != null
                && !window.unit().isSubDay();
    }

    /**
     * Bucket label expression for the window's unit in {@code zone}.
     */
    public static SqlFragment bucket(TimeColumn column, TimeWindow window, ZoneId zone, SqlDialect dialect) {
        if (window.unit() == null) {
            throw new InvalidTimeUnitException(null);
        }
        if (useDateColumn(column, window)) {
            return SqlFragment.raw(dialect.formatDateColumn(column.dateBasedExpr(), window.unit()));
        }
        return bucket(column.expr(), column.encoding(), window.unit(), zone, dialect);
    }

    public static SqlFragment bucket(String columnExpr, DateEncoding encoding, DateUnit unit, ZoneId zone,
                                     SqlDialect dialect) {
        if (unit == null) {
            throw new InvalidTimeUnitException(null);
        }
        if (encoding == DateEncoding.DATE) {
            // calendar dates carry no time of day, shifting them would move the day
            return SqlFragment.raw(dialect.formatBucket(dialect.toUtcTimestamp(columnExpr, encoding), unit));
        }
        SqlFragment zoned = dialect.toZone(dialect.toUtcTimestamp(columnExpr, encoding), zone);
        return new SqlFragment(dialect.formatBucket(zoned.sql(), unit), zoned.params());
    }

    /**
     * Inclusive time range predicate. When the calendar-date column is allowed it prunes
     * by whole days first; the timestamp range still bounds the rows, so partial days at
     * either end of the window are cut exactly as without the date column.
     */
    public static SqlFragment rangePredicate(TimeColumn column, TimeWindow window, ZoneId zone) {
        SqlFragment exact = rangePredicate(column.expr(), column.encoding(), window.startAt(), window.endAt(), zone);
        if (!useDateColumn(column, window)) {
            return exact;
        }
        return SqlFragment.of(column.dateBasedExpr() + " BETWEEN ? AND ? AND ",
                        DateEncoding.DATE.encode(window.startAt(), zone),
                        DateEncoding.DATE.encode(window.endAt(), zone))
                .append(exact);
    }

    public static SqlFragment rangePredicate(String columnExpr, DateEncoding encoding,
                                             Instant startAt, Instant endAt, ZoneId zone) {
        return SqlFragment.of(columnExpr + " BETWEEN ? AND ?",
                encoding.encode(startAt, zone),
                encoding.encode(endAt, zone));
    }
}
