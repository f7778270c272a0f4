package com.asiainfo.insights.core.model;

public enum SortOrder {
    ASC,
    DESC;

    public String comparator() {
        return this == ASC ? ">" : "<";
    }
}
