package com.abba.vpnstore.domain.exception;

/**
 * Thrown when a trial is requested by a user who already consumed it.
 */
public class AlreadyGrantedException extends StorefrontException {

    public AlreadyGrantedException(String message) {
        super(message);
    }
}
