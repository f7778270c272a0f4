package com.asiainfo.insights.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 过滤/分组字段的值类型，决定可用的操作符集合
 */
public enum FilterValueType {
    STRING,
    NUMBER,
    DATE,
    OTHER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static FilterValueType fromWireName(String name) {
        if (name == null) {
            return OTHER;
        }
        for (FilterValueType type : values()) {
            if (type.name().equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        return OTHER;
    }
}
