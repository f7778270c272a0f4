package com.asiainfo.insights.core.generator;

import java.util.regex.Pattern;

/**
 * Log-safe rendering of JDBC urls.
 */
public final class ConnectionStrings {

    private static final Pattern USER_INFO = Pattern.compile("//[^/@]*@");
    private static final Pattern SECRET_PARAM = Pattern.compile("(?i)(password|pwd|user|secret|token)=[^&;]*");

    private ConnectionStrings() {}

    public static String redact(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "null";
        }
        String redacted = USER_INFO.matcher(jdbcUrl).replaceAll("//***@");
        return SECRET_PARAM.matcher(redacted).replaceAll("$1=***");
    }

    /**
     * {@code jdbc:mysql} part of the url.
     */
    public static String scheme(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "null";
        }
        int first = jdbcUrl.indexOf(':');
        int second = first < 0 ? -1 : jdbcUrl.indexOf(':', first + 1);
        return second < 0 ? redact(jdbcUrl) : jdbcUrl.substring(0, second);
    }
}
