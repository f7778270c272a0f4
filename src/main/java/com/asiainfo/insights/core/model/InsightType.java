package com.asiainfo.insights.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 洞察目标类型，决定使用哪一套物理 schema
 */
public enum InsightType {
    INTERNAL("internal"),
    WAREHOUSE_LONG("warehouse-long"),
    WAREHOUSE_WIDE("warehouse-wide");

    private final String wireName;

    InsightType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isWarehouse() {
        return this != INTERNAL;
    }

    @JsonCreator
    public static InsightType fromWireName(String name) {
        for (InsightType type : values()) {
            if (type.wireName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown insight type: " + name);
    }
}
