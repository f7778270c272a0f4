package com.asiainfo.insights.core.generator;

import com.asiainfo.insights.core.exception.InvalidQueryException;
import com.asiainfo.insights.core.model.DateEncoding;
import com.asiainfo.insights.core.model.FilterOperator;
import com.asiainfo.insights.core.model.FilterValueType;
import com.asiainfo.insights.core.model.SqlFragment;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * 把 (类型, 操作符, 操作数, 列) 编译为带绑定参数的布尔谓词。
 * 操作数一律绑定，列表达式由调用方保证已通过 SafeIdentifier
 */
public final class FilterOperatorCompiler {

    private static final char LIKE_ESCAPE = '!';
    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private FilterOperatorCompiler() {}

    public static SqlFragment compile(FilterValueType type, String operator, Object value, String columnExpr) {
        return compile(type, operator, value, columnExpr, DateEncoding.DATETIME, ZoneOffset.UTC);
    }

    /**
     * @param dateEncoding storage of the column when {@code type} is date
     * @param zone         zone that date-only operands are read in
     */
    public static SqlFragment compile(FilterValueType type, String operator, Object value, String columnExpr,
                                      DateEncoding dateEncoding, ZoneId zone) {
        FilterValueType valueType = type == null ? FilterValueType.OTHER : type;
        FilterOperator op = FilterOperator.resolve(operator, valueType);
        OperandConverter converter = new OperandConverter(valueType,
                dateEncoding == null ? DateEncoding.DATETIME : dateEncoding, zone);

        return switch (op) {
            case EQUALS -> comparison(columnExpr, "=", converter.scalar(value));
            case NOT_EQUALS -> comparison(columnExpr, "<>", converter.scalar(value));
            case GREATER_THAN -> comparison(columnExpr, ">", converter.scalar(value));
            case GREATER_THAN_OR_EQUAL -> comparison(columnExpr, ">=", converter.scalar(value));
            case LESS_THAN -> comparison(columnExpr, "<", converter.scalar(value));
            case LESS_THAN_OR_EQUAL -> comparison(columnExpr, "<=", converter.scalar(value));
            case CONTAINS -> SqlFragment.of(columnExpr + " LIKE ? ESCAPE '" + LIKE_ESCAPE + "'",
                    likePattern(value));
            case NOT_CONTAINS -> SqlFragment.of(columnExpr + " NOT LIKE ? ESCAPE '" + LIKE_ESCAPE + "'",
                    likePattern(value));
            case BETWEEN -> between(columnExpr, converter, value);
            case IN -> in(columnExpr, converter.list(value), false);
            case NOT_IN -> in(columnExpr, converter.list(value), true);
            case IS_NULL -> SqlFragment.raw(columnExpr + " IS NULL");
            case IS_NOT_NULL -> SqlFragment.raw(columnExpr + " IS NOT NULL");
        };
    }

    /**
     * Projects a custom group entry as a 0/1 column.
     */
    public static SqlFragment project(FilterValueType type, String operator, Object value, String columnExpr,
                                      DateEncoding dateEncoding, ZoneId zone) {
        return compile(type, operator, value, columnExpr, dateEncoding, zone)
                .wrap("CASE WHEN ", " THEN 1 ELSE 0 END");
    }

    private static SqlFragment comparison(String columnExpr, String symbol, Object operand) {
        return SqlFragment.of(columnExpr + " " + symbol + " ?", operand);
    }

    private static SqlFragment between(String columnExpr, OperandConverter converter, Object value) {
        List<Object> bounds = converter.list(value);
        if (bounds.size() != 2) {
            throw new InvalidQueryException("between requires exactly two values, got " + bounds.size());
        }
        return SqlFragment.of(columnExpr + " BETWEEN ? AND ?", bounds.get(0), bounds.get(1));
    }

    private static SqlFragment in(String columnExpr, List<Object> values, boolean negated) {
        if (values.isEmpty()) {
            // IN () is not valid SQL
            return SqlFragment.raw(negated ? "1 = 1" : "1 = 0");
        }
        String placeholders = String.join(", ", Collections.nCopies(values.size(), "?"));
        return new SqlFragment(columnExpr + (negated ? " NOT IN (" : " IN (") + placeholders + ")", values);
    }

    static String likePattern(Object value) {
        if (value == null) {
            throw new InvalidQueryException("contains requires a value");
        }
        String text = String.valueOf(value);
        StringBuilder sb = new StringBuilder("%");
        for (char c : text.toCharArray()) {
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                sb.append(LIKE_ESCAPE);
            }
            sb.append(c);
        }
        return sb.append('%').toString();
    }

    /**
     * Normalizes operands into JDBC-bindable values of the column's type.
     */
    private record OperandConverter(FilterValueType type, DateEncoding dateEncoding, ZoneId zone) {

        Object scalar(Object value) {
            if (value == null) {
                throw new InvalidQueryException("Filter operand must not be null");
            }
            if (value instanceof Collection<?> || value instanceof Object[]) {
                throw new InvalidQueryException("Filter operand must be a single value");
            }
            return switch (type) {
                case STRING -> String.valueOf(value);
                case NUMBER -> number(value);
                case DATE -> dateEncoding.encode(instant(value), zone);
                case OTHER -> value;
            };
        }

        List<Object> list(Object value) {
            Collection<?> values;
            if (value instanceof Collection<?> collection) {
                values = collection;
            } else if (value instanceof Object[] array) {
                values = Arrays.asList(array);
            } else if (value == null) {
                throw new InvalidQueryException("Filter operand must not be null");
            } else {
                values = List.of(value);
            }
            List<Object> converted = new ArrayList<>(values.size());
            for (Object item : values) {
                converted.add(scalar(item));
            }
            return converted;
        }

        private static Object number(Object value) {
            if (value instanceof Number) {
                return value;
            }
            String text = String.valueOf(value).trim();
            BigDecimal decimal;
            try {
                decimal = new BigDecimal(text);
            } catch (NumberFormatException e) {
                throw new InvalidQueryException("Not a number: " + text);
            }
            if (decimal.scale() <= 0 && decimal.compareTo(LONG_MIN) >= 0 && decimal.compareTo(LONG_MAX) <= 0) {
                return decimal.longValue();
            }
            return decimal.doubleValue();
        }

        /**
         * epoch millis, ISO instant, {@code yyyy-MM-dd} or {@code yyyy-MM-dd HH:mm:ss} in the query zone
         */
        private Instant instant(Object value) {
            if (value instanceof Number number) {
                return Instant.ofEpochMilli(number.longValue());
            }
            if (value instanceof Instant instant) {
                return instant;
            }
            String text = String.valueOf(value).trim();
            if (text.matches("-?\\d+")) {
                return Instant.ofEpochMilli(Long.parseLong(text));
            }
            Instant parsed = parseOrNull(() -> Instant.parse(text));
            if (parsed == null) {
                parsed = parseOrNull(() -> LocalDate.parse(text, DateEncoding.DATE_FORMAT).atStartOfDay(zone).toInstant());
            }
            if (parsed == null) {
                parsed = parseOrNull(() -> LocalDateTime.parse(text, DateEncoding.DATETIME_FORMAT).atZone(zone).toInstant());
            }
            if (parsed == null) {
                throw new InvalidQueryException("Not a date: " + text);
            }
            return parsed;
        }

        private static Instant parseOrNull(Supplier<Instant> parser) {
            try {
                return parser.get();
            } catch (DateTimeException e) {
                return null;
            }
        }
    }
}
