package com.abba.vpnstore.domain.exception;

public class UserNotFoundException extends StorefrontException {

    public UserNotFoundException(String message) {
        super(message);
    }
}
