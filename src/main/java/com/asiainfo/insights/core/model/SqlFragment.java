package com.asiainfo.insights.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * SQL 片段：文本中的每个 {@code ?} 按顺序对应 params 中的一个绑定值。
 * 标识符永远不作为参数，只通过 SafeIdentifier 拼入文本
 */
public record SqlFragment(String sql, List<Object> params) {

    public SqlFragment {
        params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static SqlFragment raw(String sql) {
        return new SqlFragment(sql, List.of());
    }

    public static SqlFragment of(String sql, Object... params) {
        return new SqlFragment(sql, Arrays.asList(params));
    }

    public SqlFragment append(String text) {
        return new SqlFragment(sql + text, params);
    }

    public SqlFragment append(SqlFragment other) {
        List<Object> merged = new ArrayList<>(params);
        merged.addAll(other.params);
        return new SqlFragment(sql + other.sql, merged);
    }

    public SqlFragment wrap(String prefix, String suffix) {
        return new SqlFragment(prefix + sql + suffix, params);
    }

    public static SqlFragment join(List<SqlFragment> fragments, String separator) {
        return join(fragments, separator, "", "");
    }

    public static SqlFragment join(List<SqlFragment> fragments, String separator, String prefix, String suffix) {
        StringBuilder sql = new StringBuilder(prefix);
        List<Object> params = new ArrayList<>();
        for (int i = 0; i < fragments.size(); i++) {
            if (i > 0) {
                sql.append(separator);
            }
            sql.append(fragments.get(i).sql());
            params.addAll(fragments.get(i).params());
        }
        sql.append(suffix);
        return new SqlFragment(sql.toString(), params);
    }
}
