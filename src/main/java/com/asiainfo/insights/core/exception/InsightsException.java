package com.asiainfo.insights.core.exception;

/**
 * Root of every failure raised while compiling or executing an insights query.
 */
public abstract class InsightsException extends RuntimeException {

    protected InsightsException(String message) {
        super(message);
    }

    protected InsightsException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * True when the caller sent something the engine cannot compile.
     */
    public boolean isRequestError() {
        return false;
    }
}
