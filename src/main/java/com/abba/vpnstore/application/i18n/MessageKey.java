package com.abba.vpnstore.application.i18n;

import java.util.Locale;

/**
 * Every text the storefront renders. The bundle key is the lower-case constant name.
 */
public enum MessageKey {
    LANGUAGE_PROMPT,
    CHANGE_LANGUAGE,
    WELCOME,
    WELCOME_REFERRED,
    WELCOME_TRIAL,
    CHOOSE_OPTION,
    WELCOME_BACK,
    BTN_TRIAL,
    BTN_BUY,
    BTN_ACCOUNT,
    BTN_REFERRAL,
    BTN_PROMO,
    BTN_ABOUT,
    BTN_HELP,
    BTN_SUPPORT,
    BTN_ADMIN,
    BTN_BACK,
    BTN_LANGUAGE,
    BTN_PAY_STARS,
    BTN_PAY_CARD,
    BTN_PAY_CRYPTO,
    PLAN_BUTTON,
    DURATION_BUTTON,
    DURATION_DAYS,
    DURATION_YEAR,
    TRIAL_USED,
    TRIAL_ACTIVATED,
    PLANS_TITLE,
    PLAN_ITEM,
    PLANS_FEATURES,
    DURATION_TITLE,
    DURATION_ITEM,
    PAYMENT_TITLE,
    PAYMENT_PENDING,
    PAYMENT_SUCCESS,
    PAYMENT_FAILED,
    INVOICE_TITLE,
    INVOICE_DESCRIPTION,
    ACCOUNT_TITLE,
    STATUS_NO_SUB,
    STATUS_EXPIRED,
    STATUS_ACTIVE,
    ABOUT_TEXT,
    HELP_TEXT,
    SUPPORT_TEXT,
    PROMO_UNAVAILABLE,
    REFERRAL_TEXT,
    ADMIN_TITLE,
    GENERIC_FAILURE,
    ACTION_UNAVAILABLE;

    public String bundleKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
