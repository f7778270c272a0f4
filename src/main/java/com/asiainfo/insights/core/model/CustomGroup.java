package com.asiainfo.insights.core.model;

public record CustomGroup(String filterOperator, Object filterValue) {
}
