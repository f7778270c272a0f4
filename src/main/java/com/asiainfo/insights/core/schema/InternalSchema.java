package com.asiainfo.insights.core.schema;

import com.asiainfo.insights.core.exception.InvalidQueryException;
import com.asiainfo.insights.core.generator.SafeIdentifier;
import com.asiainfo.insights.core.model.DateEncoding;

import java.util.Set;

/**
 * 内置事件存储的固定表结构。
 * insightId 即 website_id，所有查询都限定在该范围内
 */
public final class InternalSchema {

    public static final String TABLE = "website_event";

    public static final String ID = "id";
    public static final String WEBSITE_ID = "website_id";
    public static final String SESSION_ID = "session_id";
    public static final String EVENT_NAME = "event_name";
    public static final String CREATED_AT = "created_at";
    public static final DateEncoding CREATED_AT_ENCODING = DateEncoding.TIMESTAMP_MS;

    // columns that filters and groups may reference
    private static final Set<String> QUERYABLE = Set.of(
            ID, SESSION_ID, EVENT_NAME, CREATED_AT,
            "url_path", "url_query", "referrer_domain", "page_title",
            "browser", "os", "device", "country", "region", "city", "language");

    private InternalSchema() {}

    public static SafeIdentifier column(String name) {
        if (name == null || !QUERYABLE.contains(name)) {
            throw new InvalidQueryException("Unknown field: " + name);
        }
        return SafeIdentifier.of(name);
    }

    public static Set<String> queryableColumns() {
        return QUERYABLE;
    }
}
