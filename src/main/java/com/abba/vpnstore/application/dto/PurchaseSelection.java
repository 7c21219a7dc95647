package com.abba.vpnstore.application.dto;

import com.abba.vpnstore.domain.exception.InvalidSelectionException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A plan index and duration picked from the catalog. Also the invoice payload of the gateway path.
 */
public record PurchaseSelection(int planIndex, int durationDays) {

    private static final Pattern PAYLOAD = Pattern.compile("plan_(\\d+)_dur_(\\d+)");

    public String toPayload() {
        return "plan_" + planIndex + "_dur_" + durationDays;
    }

    public static PurchaseSelection fromPayload(String payload) {
        Matcher matcher = payload == null ? null : PAYLOAD.matcher(payload);
        if (matcher == null || !matcher.matches()) {
            throw new InvalidSelectionException("Unrecognized purchase payload: " + payload);
        }
        try {
            return new PurchaseSelection(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
        } catch (NumberFormatException e) {
            throw new InvalidSelectionException("Purchase payload out of range: " + payload);
        }
    }
}
