package com.abba.vpnstore.application.navigation;

import com.abba.vpnstore.application.catalog.PlanCatalog;
import com.abba.vpnstore.application.dto.PurchaseResult;
import com.abba.vpnstore.application.dto.PurchaseSelection;
import com.abba.vpnstore.application.i18n.LocalizationProvider;
import com.abba.vpnstore.application.i18n.MessageKey;
import com.abba.vpnstore.domain.model.CatalogEntry;
import com.abba.vpnstore.domain.model.EntitlementStatus;
import com.abba.vpnstore.domain.model.Language;
import com.abba.vpnstore.domain.model.LedgerStatistics;
import com.abba.vpnstore.domain.model.PaymentMethod;
import com.abba.vpnstore.domain.model.TrialGrant;
import com.abba.vpnstore.domain.model.User;
import com.abba.vpnstore.domain.service.EntitlementEngine;
import com.abba.vpnstore.infrastructure.config.StorefrontProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the text and options of every screen in the user's language.
 */
@Component
@RequiredArgsConstructor
public class ScreenRenderer {

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final int YEAR_DAYS = 365;

    private final LocalizationProvider localizationProvider;
    private final PlanCatalog planCatalog;
    private final EntitlementEngine entitlementEngine;
    private final StorefrontProperties storefrontProperties;
    private final Clock clock;

    public RenderedScreen languagePick(Language language, boolean changing) {
        String text = changing
                ? t(language, MessageKey.CHANGE_LANGUAGE)
                : t(language, MessageKey.LANGUAGE_PROMPT);
        List<List<ActionOption>> rows = new ArrayList<>();
        for (Language option : Language.values()) {
            rows.add(List.of(new ActionOption(option.flag() + " " + option.nativeName(),
                    ActionToken.of(Actions.LANGUAGE, option.code()))));
        }
        return new RenderedScreen(Screen.LANGUAGE_PICK, text, rows);
    }

    public RenderedScreen welcomeNew(User user, String displayName) {
        Language language = user.getLanguage();
        String text = t(language, MessageKey.WELCOME, Map.of("name", displayName))
                + t(language, user.hasReferrer() ? MessageKey.WELCOME_REFERRED : MessageKey.WELCOME_TRIAL)
                + t(language, MessageKey.CHOOSE_OPTION);
        return new RenderedScreen(Screen.MAIN_MENU, text, mainMenuOptions(user));
    }

    public RenderedScreen welcomeBack(User user, String displayName) {
        String text = t(user.getLanguage(), MessageKey.WELCOME_BACK,
                Map.of("name", displayName, "status", statusText(user)));
        return new RenderedScreen(Screen.MAIN_MENU, text, mainMenuOptions(user));
    }

    /**
     * Pre-trial users get the short menu, everyone else the full one. Operators always get Admin.
     */
    public List<List<ActionOption>> mainMenuOptions(User user) {
        Language language = user.getLanguage();
        List<List<ActionOption>> rows = new ArrayList<>();
        if (!user.isTrialUsed()) {
            rows.add(List.of(option(language, MessageKey.BTN_TRIAL, Actions.TRIAL)));
            rows.add(List.of(option(language, MessageKey.BTN_BUY, Actions.PLANS)));
            rows.add(List.of(option(language, MessageKey.BTN_ABOUT, Actions.ABOUT),
                    option(language, MessageKey.BTN_SUPPORT, Actions.SUPPORT)));
        } else {
            rows.add(List.of(option(language, MessageKey.BTN_BUY, Actions.PLANS)));
            rows.add(List.of(option(language, MessageKey.BTN_ACCOUNT, Actions.ACCOUNT)));
            rows.add(List.of(option(language, MessageKey.BTN_REFERRAL, Actions.REFERRALS),
                    option(language, MessageKey.BTN_PROMO, Actions.PROMO)));
            rows.add(List.of(option(language, MessageKey.BTN_HELP, Actions.HELP),
                    option(language, MessageKey.BTN_SUPPORT, Actions.SUPPORT)));
        }
        rows.add(List.of(option(language, MessageKey.BTN_LANGUAGE, Actions.CHANGE_LANGUAGE)));
        if (storefrontProperties.isAdmin(user.getId())) {
            rows.add(List.of(option(language, MessageKey.BTN_ADMIN, Actions.ADMIN)));
        }
        return rows;
    }

    public RenderedScreen trialActivated(User user, TrialGrant grant) {
        String text = t(user.getLanguage(), MessageKey.TRIAL_ACTIVATED, Map.of(
                "days", grant.days(),
                "expires", DATE_TIME.format(grant.expiresAt()),
                "config", grant.provisioningToken()));
        return new RenderedScreen(Screen.TRIAL_RESULT, text, buyOrBack(user.getLanguage()));
    }

    public RenderedScreen trialUsed(User user) {
        return new RenderedScreen(Screen.TRIAL_RESULT, t(user.getLanguage(), MessageKey.TRIAL_USED),
                buyOrBack(user.getLanguage()));
    }

    public RenderedScreen planList(User user) {
        Language language = user.getLanguage();
        StringBuilder text = new StringBuilder(t(language, MessageKey.PLANS_TITLE));
        List<List<ActionOption>> rows = new ArrayList<>();
        List<CatalogEntry> entries = planCatalog.entries();
        for (int i = 0; i < entries.size(); i++) {
            CatalogEntry plan = entries.get(i);
            Map<String, Object> params = Map.of(
                    "name", plan.planName(),
                    "devices", plan.devices(),
                    "plural", plan.devices() > 1 ? "s" : "",
                    "price", money(planCatalog.price(i, PlanCatalog.BASE_DURATION)));
            text.append(t(language, MessageKey.PLAN_ITEM, params));
            rows.add(List.of(new ActionOption(t(language, MessageKey.PLAN_BUTTON, params), ActionToken.of(Actions.PLAN, i))));
        }
        text.append(t(language, MessageKey.PLANS_FEATURES));
        rows.add(List.of(option(language, MessageKey.BTN_BACK, Actions.MENU)));
        return new RenderedScreen(Screen.PLAN_LIST, text.toString(), rows);
    }

    public RenderedScreen durationList(User user, int planIndex) {
        Language language = user.getLanguage();
        CatalogEntry plan = planCatalog.plan(planIndex);
        StringBuilder text = new StringBuilder(t(language, MessageKey.DURATION_TITLE,
                Map.of("plan_name", plan.planName(), "devices", plan.devices())));
        List<List<ActionOption>> rows = new ArrayList<>();
        for (int days : planCatalog.durations()) {
            BigDecimal price = planCatalog.price(planIndex, days);
            String label = durationLabel(language, days);
            text.append(t(language, MessageKey.DURATION_ITEM, Map.of(
                    "label", label,
                    "price", money(price),
                    "monthly", monthly(price, days))));
            rows.add(List.of(new ActionOption(
                    t(language, MessageKey.DURATION_BUTTON, Map.of("label", label, "price", money(price))),
                    ActionToken.of(Actions.DURATION, planIndex, days))));
        }
        rows.add(List.of(option(language, MessageKey.BTN_BACK, Actions.PLANS)));
        return new RenderedScreen(Screen.DURATION_LIST, text.toString(), rows);
    }

    public RenderedScreen paymentMethods(User user, PurchaseSelection selection) {
        Language language = user.getLanguage();
        CatalogEntry plan = planCatalog.plan(selection.planIndex());
        BigDecimal price = planCatalog.price(selection.planIndex(), selection.durationDays());
        String text = t(language, MessageKey.PAYMENT_TITLE, Map.of(
                "plan", plan.planName(),
                "duration", selection.durationDays(),
                "price", money(price)));
        List<List<ActionOption>> rows = List.of(
                List.of(payOption(language, MessageKey.BTN_PAY_STARS, PaymentMethod.STARS, selection)),
                List.of(payOption(language, MessageKey.BTN_PAY_CARD, PaymentMethod.CARD, selection)),
                List.of(payOption(language, MessageKey.BTN_PAY_CRYPTO, PaymentMethod.CRYPTO, selection)),
                List.of(new ActionOption(t(language, MessageKey.BTN_BACK),
                        ActionToken.of(Actions.PLAN, selection.planIndex()))));
        return new RenderedScreen(Screen.PAYMENT_METHOD_LIST, text, rows);
    }

    public RenderedScreen paymentPending(User user, PurchaseSelection selection) {
        Language language = user.getLanguage();
        CatalogEntry plan = planCatalog.plan(selection.planIndex());
        String text = t(language, MessageKey.PAYMENT_PENDING, Map.of(
                "plan", plan.planName(),
                "duration", selection.durationDays(),
                "price", money(planCatalog.price(selection.planIndex(), selection.durationDays()))));
        return new RenderedScreen(Screen.PAYMENT_PENDING, text, backToMenu(language));
    }

    public RenderedScreen paymentResult(User user, PurchaseResult purchase) {
        Language language = user.getLanguage();
        String text = t(language, MessageKey.PAYMENT_SUCCESS, Map.of(
                "plan", purchase.plan().planName(),
                "duration", purchase.durationDays(),
                "price", money(purchase.price()),
                "expires", DATE.format(purchase.expiresAt()),
                "config", purchase.provisioningToken()));
        List<List<ActionOption>> rows = List.of(
                List.of(option(language, MessageKey.BTN_ACCOUNT, Actions.ACCOUNT)),
                List.of(option(language, MessageKey.BTN_BUY, Actions.PLANS)),
                List.of(option(language, MessageKey.BTN_REFERRAL, Actions.REFERRALS)),
                List.of(option(language, MessageKey.BTN_BACK, Actions.MENU)));
        return new RenderedScreen(Screen.PAYMENT_RESULT, text, rows);
    }

    public RenderedScreen account(User user, long referrals) {
        Language language = user.getLanguage();
        String text = t(language, MessageKey.ACCOUNT_TITLE, Map.of(
                "user_id", user.getId(),
                "name", user.getDisplayName() == null ? "" : user.getDisplayName(),
                "date", user.getCreatedAt() == null ? "--" : DATE.format(user.getCreatedAt()),
                "status", statusText(user),
                "spent", money(user.getTotalPaid()),
                "refs", referrals));
        return new RenderedScreen(Screen.ACCOUNT_VIEW, text, buyOrBack(language));
    }

    public RenderedScreen info(User user, MessageKey key) {
        Language language = user.getLanguage();
        String text = t(language, key, Map.of("support", storefrontProperties.supportUsername()));
        return new RenderedScreen(Screen.INFO_VIEW, text, backToMenu(language));
    }

    public RenderedScreen referral(User user, long referrals) {
        Language language = user.getLanguage();
        String text = t(language, MessageKey.REFERRAL_TEXT, Map.of(
                "link", storefrontProperties.referralLink(user.getId()),
                "refs", referrals));
        return new RenderedScreen(Screen.INFO_VIEW, text, backToMenu(language));
    }

    public RenderedScreen admin(User user, LedgerStatistics statistics) {
        Language language = user.getLanguage();
        String text = t(language, MessageKey.ADMIN_TITLE, Map.of(
                "users", statistics.totalUsers(),
                "active", statistics.activeUsers(),
                "payments", statistics.completedPayments()));
        return new RenderedScreen(Screen.ADMIN_VIEW, text, backToMenu(language));
    }

    public RenderedScreen failure(Language language) {
        return new RenderedScreen(Screen.FAILURE, t(language, MessageKey.GENERIC_FAILURE), backToMenu(language));
    }

    public RenderedScreen paymentFailed(Language language) {
        return new RenderedScreen(Screen.FAILURE, t(language, MessageKey.PAYMENT_FAILED), backToMenu(language));
    }

    public String notice(Language language, MessageKey key) {
        return t(language, key);
    }

    public String statusText(User user) {
        EntitlementStatus status = entitlementEngine.statusOf(user, clock.instant());
        return switch (status.kind()) {
            case NO_SUBSCRIPTION -> t(user.getLanguage(), MessageKey.STATUS_NO_SUB);
            case EXPIRED -> t(user.getLanguage(), MessageKey.STATUS_EXPIRED);
            case ACTIVE -> t(user.getLanguage(), MessageKey.STATUS_ACTIVE, Map.of("days", status.daysLeft()));
        };
    }

    private String durationLabel(Language language, int days) {
        return days < YEAR_DAYS
                ? t(language, MessageKey.DURATION_DAYS, Map.of("days", days))
                : t(language, MessageKey.DURATION_YEAR);
    }

    private List<List<ActionOption>> buyOrBack(Language language) {
        return List.of(
                List.of(option(language, MessageKey.BTN_BUY, Actions.PLANS)),
                List.of(option(language, MessageKey.BTN_BACK, Actions.MENU)));
    }

    private List<List<ActionOption>> backToMenu(Language language) {
        return List.of(List.of(option(language, MessageKey.BTN_BACK, Actions.MENU)));
    }

    private ActionOption option(Language language, MessageKey label, String token) {
        return new ActionOption(t(language, label), token);
    }

    private ActionOption payOption(Language language, MessageKey label, PaymentMethod method, PurchaseSelection selection) {
        return new ActionOption(t(language, label),
                ActionToken.of(Actions.PAY, method.code(), selection.planIndex(), selection.durationDays()));
    }

    private String t(Language language, MessageKey key) {
        return localizationProvider.text(language, key);
    }

    private String t(Language language, MessageKey key, Map<String, ?> params) {
        return localizationProvider.text(language, key, params);
    }

    private static String money(BigDecimal amount) {
        return amount == null ? "0" : amount.stripTrailingZeros().toPlainString();
    }

    private static String monthly(BigDecimal price, int days) {
        return price.multiply(BigDecimal.valueOf(PlanCatalog.BASE_DURATION))
                .divide(BigDecimal.valueOf(days), 2, RoundingMode.HALF_UP)
                .toPlainString();
    }
}
