package com.asiainfo.insights.core.exception;

import com.asiainfo.insights.core.model.InsightType;

public class ApplicationNotFoundException extends InsightsException {

    private final String insightId;
    private final InsightType insightType;

    public ApplicationNotFoundException(String insightId, InsightType insightType) {
        super("Application " + insightId + " not found for insight type " + insightType.wireName());
        this.insightId = insightId;
        this.insightType = insightType;
    }

    public String getInsightId() {
        return insightId;
    }

    public InsightType getInsightType() {
        return insightType;
    }

    @Override
    public boolean isRequestError() {
        return true;
    }
}
