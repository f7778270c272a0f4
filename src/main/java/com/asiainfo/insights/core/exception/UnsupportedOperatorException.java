package com.asiainfo.insights.core.exception;

import com.asiainfo.insights.core.model.FilterValueType;

public class UnsupportedOperatorException extends InsightsException {

    private final String operator;

    public UnsupportedOperatorException(String operator, FilterValueType type) {
        super(type == null
                ? "Unsupported filter operator: " + operator
                : "Unsupported filter operator '" + operator + "' for type " + type.wireName());
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }

    @Override
    public boolean isRequestError() {
        return true;
    }
}
