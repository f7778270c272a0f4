package com.asiainfo.insights.core.model;

import java.util.List;

/**
 * 分组定义。没有 customGroups 时按原始值分组；
 * 有 customGroups 时每个条目展开为一个派生列
 */
public record GroupInfo(String value, FilterValueType type, List<CustomGroup> customGroups) {

    public static GroupInfo of(String value, FilterValueType type) {
        return new GroupInfo(value, type, null);
    }

    public boolean hasCustomGroups() {
        return customGroups != null && !customGroups.isEmpty();
    }
}
