package com.asiainfo.insights.api.dto;

import com.asiainfo.insights.core.exception.InvalidQueryException;
import com.asiainfo.insights.core.model.InsightType;

final class RequestSupport {

    private RequestSupport() {}

    static InsightType insightType(String wireName) {
        if (wireName == null) {
            throw new InvalidQueryException("insightType is required");
        }
        try {
            return InsightType.fromWireName(wireName);
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException(e.getMessage());
        }
    }
}
