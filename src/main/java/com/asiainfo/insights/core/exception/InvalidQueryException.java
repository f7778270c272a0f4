package com.asiainfo.insights.core.exception;

/**
 * Malformed request content: rejected identifiers, bad operands, timezone, cursor or limit.
 */
public class InvalidQueryException extends InsightsException {

    public InvalidQueryException(String message) {
        super(message);
    }

    @Override
    public boolean isRequestError() {
        return true;
    }
}
