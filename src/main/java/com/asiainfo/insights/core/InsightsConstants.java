package com.asiainfo.insights.core;

public class InsightsConstants {
    // metric name meaning "count every event", never a real event name
    public static final String ALL_EVENT = "$all_event";

    // reserved alias prefix of group-derived columns
    public static final String GROUP_PREFIX = "%";

    // separates value|operator|literal inside a custom group alias
    public static final String GROUP_DELIMITER = "|";

    // bucket label column of every aggregation statement
    public static final String DATE_COLUMN = "date";

    public static final String DEFAULT_TIMEZONE = "UTC";

    private InsightsConstants() {}
}
