package com.asiainfo.insights.infra.persistence;

import com.asiainfo.insights.core.generator.SqlDialect;
import com.asiainfo.insights.core.model.InsightType;
import com.asiainfo.insights.core.schema.WarehouseApplication;

import javax.sql.DataSource;

/**
 * 一次查询解析出的物理目标
 *
 * @param application null for the internal store
 * @param dataSource  pool the statement runs on
 */
public record ResolvedInsight(
        InsightType type,
        WarehouseApplication application,
        DataSource dataSource,
        SqlDialect dialect
) {
}
