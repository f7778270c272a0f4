package com.asiainfo.insights.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * @param nextCursor absent at the end of the stream
 */
public record EventPage(
        List<Map<String, Object>> items,
        @JsonInclude(JsonInclude.Include.NON_NULL) String nextCursor
) {
    public boolean hasMore() {
        return nextCursor != null;
    }
}
