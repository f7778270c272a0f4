package com.asiainfo.insights.core.model;

/**
 * Top-level filter. All filters of a query are conjoined.
 *
 * @param value scalar, or a list for {@code between}/{@code in}; null for the null checks
 */
public record FilterInfo(String name, FilterValueType type, String operator, Object value) {
}
