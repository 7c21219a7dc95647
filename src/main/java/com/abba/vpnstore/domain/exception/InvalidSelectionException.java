package com.abba.vpnstore.domain.exception;

public class InvalidSelectionException extends StorefrontException {

    public InvalidSelectionException(String message) {
        super(message);
    }
}
