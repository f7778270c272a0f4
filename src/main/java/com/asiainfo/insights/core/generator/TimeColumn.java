package com.asiainfo.insights.core.generator;

import com.asiainfo.insights.core.model.DateEncoding;

/**
 * A table's creation-time column as it appears in SQL text.
 *
 * @param expr          quoted, possibly qualified column expression
 * @param encoding      physical storage of {@code expr}
 * @param dateBasedExpr optional calendar-date companion column, or null
 */
public record TimeColumn(String expr, DateEncoding encoding, String dateBasedExpr) {

    public TimeColumn {
        encoding = encoding == null ? DateEncoding.TIMESTAMP_MS : encoding;
    }

    public boolean hasDateBasedColumn() {
        return dateBasedExpr != null;
    }
}
