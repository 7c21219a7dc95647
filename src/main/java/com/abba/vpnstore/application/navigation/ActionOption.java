package com.abba.vpnstore.application.navigation;

public record ActionOption(String label, String token) {
}
