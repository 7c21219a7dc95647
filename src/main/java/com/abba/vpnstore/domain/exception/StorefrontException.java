package com.abba.vpnstore.domain.exception;

/**
 * Base type for failures that abort a single conversation turn.
 */
public abstract class StorefrontException extends RuntimeException {

    protected StorefrontException(String message) {
        super(message);
    }

    protected StorefrontException(String message, Throwable cause) {
        super(message, cause);
    }
}
