package com.asiainfo.insights.core.model;

/**
 * Per-request context handed in by the caller.
 */
public record InsightsContext(String timezone) {
}
