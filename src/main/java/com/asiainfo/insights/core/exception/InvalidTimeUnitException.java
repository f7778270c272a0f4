package com.asiainfo.insights.core.exception;

public class InvalidTimeUnitException extends InsightsException {

    public InvalidTimeUnitException(String unit) {
        super("Invalid date unit: " + unit);
    }

    @Override
    public boolean isRequestError() {
        return true;
    }
}
