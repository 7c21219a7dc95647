package com.abba.vpnstore.application.navigation;

public enum Screen {
    LANGUAGE_PICK,
    MAIN_MENU,
    PLAN_LIST,
    DURATION_LIST,
    PAYMENT_METHOD_LIST,
    PAYMENT_PENDING,
    TRIAL_RESULT,
    PAYMENT_RESULT,
    ACCOUNT_VIEW,
    INFO_VIEW,
    ADMIN_VIEW,
    FAILURE
}
