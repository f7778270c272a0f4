package com.asiainfo.insights.core.exception;

/**
 * Warehouse application configuration could not be parsed or validated.
 */
public class ApplicationConfigInvalidException extends InsightsException {

    public ApplicationConfigInvalidException(String message) {
        super(message);
    }

    public ApplicationConfigInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
