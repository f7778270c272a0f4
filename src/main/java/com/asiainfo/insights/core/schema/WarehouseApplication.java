package com.asiainfo.insights.core.schema;

import com.asiainfo.insights.core.model.InsightType;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 外部数仓中的一个应用 (物理表映射)。
 * 配置 JSON 中 {@code type} 缺省时按长表解析
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type",
        defaultImpl = LongTableApplication.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = LongTableApplication.class, name = "longTable"),
        @JsonSubTypes.Type(value = WideTableApplication.class, name = "wideTable")
})
public interface WarehouseApplication {

    String name();

    /**
     * Optional per-application JDBC url; the shared warehouse url applies when null.
     */
    String databaseUrl();

    InsightType insightType();

    /**
     * Checks required fields and that every configured name is a safe identifier.
     *
     * @throws com.asiainfo.insights.core.exception.ApplicationConfigInvalidException on the first problem
     */
    void validate();
}
