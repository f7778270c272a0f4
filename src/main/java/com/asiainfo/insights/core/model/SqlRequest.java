package com.asiainfo.insights.core.model;

import java.util.Collections;
import java.util.List;

/**
 * A complete, self-contained statement ready to execute.
 */
public record SqlRequest(String sql, List<Object> params) {
    public SqlRequest(String sql) {
        this(sql, Collections.emptyList());
    }

    public static SqlRequest of(SqlFragment fragment) {
        return new SqlRequest(fragment.sql(), fragment.params());
    }
}
