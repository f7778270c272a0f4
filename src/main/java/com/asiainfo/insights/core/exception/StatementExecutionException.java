package com.asiainfo.insights.core.exception;

import com.asiainfo.insights.core.model.InsightType;

/**
 * Wraps the storage engine's error verbatim, with the insight and backend it came from.
 */
public class StatementExecutionException extends InsightsException {

    private final String insightId;
    private final InsightType backend;

    public StatementExecutionException(String insightId, InsightType backend, Throwable cause) {
        super(cause.getMessage(), cause);
        this.insightId = insightId;
        this.backend = backend;
    }

    public String getInsightId() {
        return insightId;
    }

    public InsightType getBackend() {
        return backend;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder("Statement execution failed: ").append(super.getMessage());
        if (insightId != null) {
            sb.append(" [Insight: ").append(insightId).append("]");
        }
        if (backend != null) {
            sb.append(" [Backend: ").append(backend.wireName()).append("]");
        }
        return sb.toString();
    }
}
