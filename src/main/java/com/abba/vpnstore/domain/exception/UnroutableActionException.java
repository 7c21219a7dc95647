package com.abba.vpnstore.domain.exception;

public class UnroutableActionException extends StorefrontException {

    public UnroutableActionException(String message) {
        super(message);
    }
}
