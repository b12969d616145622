package com.hegel.fusion.exceptions;

/**
 * Thrown when a fusion model (rules and objective functions) is malformed.
 */
public class FusionModelException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public FusionModelException(String message) {
        super(message);
    }

    public FusionModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
