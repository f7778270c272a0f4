package com.asiainfo.insights.api.dto;

/**
 * 统一响应信封
 */
public record InsightsQueryResult<T>(
        T dataArray, // 数据
        String status, // 业务状态码 0000 成功 / 9999 失败
        String msg
) {

    public static <T> InsightsQueryResult<T> success(T dataArray, String msg) {
        return new InsightsQueryResult<>(dataArray, "0000", msg);
    }

    public static <T> InsightsQueryResult<T> error(String errorMsg) {
        return new InsightsQueryResult<>(null, "9999", errorMsg);
    }
}
