package com.abba.vpnstore.domain.exception;

public class PersistenceFailureException extends StorefrontException {

    public PersistenceFailureException(String message) {
        super(message);
    }

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
