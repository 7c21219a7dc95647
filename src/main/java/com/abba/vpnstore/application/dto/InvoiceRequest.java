package com.abba.vpnstore.application.dto;

/**
 * Invoice to open on the gateway path.
 *
 * @param amount total in the currency's smallest unit
 */
public record InvoiceRequest(String title, String description, String payload, String currency, long amount) {
}
