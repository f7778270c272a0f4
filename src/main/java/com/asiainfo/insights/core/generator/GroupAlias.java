package com.asiainfo.insights.core.generator;

import com.asiainfo.insights.core.InsightsConstants;
import com.asiainfo.insights.core.exception.InvalidQueryException;
import com.asiainfo.insights.core.model.FilterOperator;

import java.util.Arrays;
import java.util.Collection;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 分组列别名的编码/解码，是结果重组时区分维度列与指标列的唯一依据。
 * <pre>
 *   %country                 原始值分组
 *   %amount|&gt;|100           自定义分组条目
 * </pre>
 */
public record GroupAlias(String value, String operator, String literal) {

    private static final Pattern DELIMITER = Pattern.compile(Pattern.quote(InsightsConstants.GROUP_DELIMITER));

    public static GroupAlias raw(String value) {
        return new GroupAlias(checkPart(value, "group value"), null, null);
    }

    public static GroupAlias custom(String value, FilterOperator operator, Object literal) {
        return new GroupAlias(checkPart(value, "group value"), operator.wireName(),
                checkLiteral(renderLiteral(literal)));
    }

    public boolean isCustom() {
        return operator != null;
    }

    public String encode() {
        if (!isCustom()) {
            return InsightsConstants.GROUP_PREFIX + value;
        }
        return InsightsConstants.GROUP_PREFIX + value
                + InsightsConstants.GROUP_DELIMITER + operator
                + InsightsConstants.GROUP_DELIMITER + literal;
    }

    /**
     * Alias ready to be placed after {@code AS}.
     */
    public String quoted() {
        return '"' + encode() + '"';
    }

    /**
     * Human readable bucket name of a custom group entry, e.g. {@code > 100}.
     */
    public String label() {
        if (!isCustom()) {
            return value;
        }
        return literal.isEmpty() ? operator : operator + " " + literal;
    }

    public static boolean isGroupColumn(String column) {
        return column != null && column.startsWith(InsightsConstants.GROUP_PREFIX);
    }

    public static GroupAlias decode(String column) {
        if (!isGroupColumn(column)) {
            throw new IllegalArgumentException("Not a group column: " + column);
        }
        String body = column.substring(InsightsConstants.GROUP_PREFIX.length());
        String[] parts = DELIMITER.split(body, -1);
        if (parts.length == 1) {
            return new GroupAlias(parts[0], null, null);
        }
        if (parts.length == 3) {
            return new GroupAlias(parts[0], parts[1], parts[2]);
        }
        throw new IllegalArgumentException("Malformed group column: " + column);
    }

    static String renderLiteral(Object literal) {
        if (literal == null) {
            return "";
        }
        if (literal instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).collect(Collectors.joining(","));
        }
        if (literal instanceof Object[] values) {
            return Arrays.stream(values).map(String::valueOf).collect(Collectors.joining(","));
        }
        return String.valueOf(literal);
    }

    private static String checkPart(String part, String what) {
        if (!SafeIdentifier.isSafe(part)) {
            throw new InvalidQueryException("Illegal " + what + ": " + part);
        }
        return part;
    }

    private static String checkLiteral(String literal) {
        // empty is allowed for operand-less operators
        if (!literal.isEmpty()) {
            checkPart(literal, "custom group value");
        }
        return literal;
    }
}
