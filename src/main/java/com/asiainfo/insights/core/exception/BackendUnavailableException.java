package com.asiainfo.insights.core.exception;

/**
 * Warehouse disabled by configuration, or no connection could be established.
 * Messages never carry a connection string.
 */
public class BackendUnavailableException extends InsightsException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
