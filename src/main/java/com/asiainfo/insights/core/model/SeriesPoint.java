package com.asiainfo.insights.core.model;

public record SeriesPoint(String date, long value) {
}
