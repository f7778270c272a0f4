package com.asiainfo.insights.core.schema;

import com.asiainfo.insights.core.model.DateEncoding;
import com.asiainfo.insights.core.model.FilterValueType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param dateType storage of a date-typed column, datetime when absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WideTableField(String name, FilterValueType type, DateEncoding dateType) {

    public WideTableField {
        type = type == null ? FilterValueType.STRING : type;
    }

    public DateEncoding dateEncoding() {
        return dateType == null ? DateEncoding.DATETIME : dateType;
    }
}
