package com.abba.vpnstore.domain.exception;

/**
 * A gateway purchase could not be recorded together with its payment, either because the commit
 * failed or because the completion carried no payment reference. Nothing from the purchase is
 * persisted when this is thrown.
 */
public class PaymentIntegrityException extends StorefrontException {

    public PaymentIntegrityException(String message) {
        super(message);
    }

    public PaymentIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
