package com.asiainfo.insights.core.model;

import com.asiainfo.insights.core.exception.UnsupportedOperatorException;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 过滤操作符。wire name 大小写不敏感，空格、下划线、连字符等价
 */
public enum FilterOperator {
    EQUALS(List.of("equals", "=")),
    NOT_EQUALS(List.of("not equals", "!=")),
    CONTAINS(List.of("contains")),
    NOT_CONTAINS(List.of("not contains")),
    GREATER_THAN(List.of("greater than", ">")),
    GREATER_THAN_OR_EQUAL(List.of("greater than or equal", ">=")),
    LESS_THAN(List.of("less than", "<")),
    LESS_THAN_OR_EQUAL(List.of("less than or equal", "<=")),
    BETWEEN(List.of("between")),
    IN(List.of("in", "in list")),
    NOT_IN(List.of("not in", "not in list")),
    IS_NULL(List.of("is null")),
    IS_NOT_NULL(List.of("is not null"));

    private static final Set<FilterOperator> UNIVERSAL = EnumSet.of(IS_NULL, IS_NOT_NULL, IN, NOT_IN);
    private static final Set<FilterOperator> STRING_OPERATORS = EnumSet.of(EQUALS, NOT_EQUALS, CONTAINS, NOT_CONTAINS);
    private static final Set<FilterOperator> ORDERED_OPERATORS = EnumSet.of(EQUALS, NOT_EQUALS, GREATER_THAN,
            GREATER_THAN_OR_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL, BETWEEN);
    private static final Set<FilterOperator> OTHER_OPERATORS = EnumSet.of(EQUALS, NOT_EQUALS);

    private final List<String> names;

    FilterOperator(List<String> names) {
        this.names = names;
    }

    /**
     * Canonical wire name, also used inside custom group aliases.
     */
    public String wireName() {
        return names.get(0);
    }

    public boolean supports(FilterValueType type) {
        if (UNIVERSAL.contains(this)) {
            return true;
        }
        return switch (type) {
            case STRING -> STRING_OPERATORS.contains(this);
            case NUMBER, DATE -> ORDERED_OPERATORS.contains(this);
            case OTHER -> OTHER_OPERATORS.contains(this);
        };
    }

    public static FilterOperator fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new UnsupportedOperatorException(String.valueOf(name), null);
        }
        String normalized = normalize(name);
        for (FilterOperator operator : values()) {
            for (String candidate : operator.names) {
                if (normalize(candidate).equals(normalized)) {
                    return operator;
                }
            }
        }
        throw new UnsupportedOperatorException(name, null);
    }

    /**
     * Resolves the operator and checks that it applies to the value type.
     */
    public static FilterOperator resolve(String name, FilterValueType type) {
        FilterOperator operator = fromWireName(name);
        if (!operator.supports(type)) {
            throw new UnsupportedOperatorException(name, type);
        }
        return operator;
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_\\-]+", " ");
    }
}
