package com.abba.vpnstore.application.navigation;

/**
 * Verbs understood by the navigation handlers.
 */
public final class Actions {

    public static final String START = "start";
    public static final String LANGUAGE = "lang";
    public static final String CHANGE_LANGUAGE = "change_lang";
    public static final String MENU = "menu";
    public static final String BACK = "back";
    public static final String TRIAL = "trial";
    public static final String PLANS = "plans";
    public static final String PLAN = "plan";
    public static final String DURATION = "dur";
    public static final String PAY = "pay";
    public static final String ACCOUNT = "account";
    public static final String REFERRALS = "referrals";
    public static final String PROMO = "promo";
    public static final String ABOUT = "about";
    public static final String HELP = "help";
    public static final String SUPPORT = "support";
    public static final String ADMIN = "admin";

    private Actions() {
    }
}
