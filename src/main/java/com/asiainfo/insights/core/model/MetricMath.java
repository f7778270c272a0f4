package com.asiainfo.insights.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MetricMath {
    EVENTS,
    SESSIONS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MetricMath fromWireName(String name) {
        return MetricMath.valueOf(name.trim().toUpperCase());
    }
}
