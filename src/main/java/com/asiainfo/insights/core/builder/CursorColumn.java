package com.asiainfo.insights.core.builder;

/**
 * @param expr  quoted column expression used in predicates and ORDER BY
 * @param label result-set label the cursor value is read from
 */
public record CursorColumn(String expr, String label) {
}
