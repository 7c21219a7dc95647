package com.abba.vpnstore.application.navigation.handler;

import com.abba.vpnstore.application.i18n.MessageKey;
import com.abba.vpnstore.application.navigation.ActionContext;
import com.abba.vpnstore.application.navigation.ActionToken;
import com.abba.vpnstore.application.navigation.Actions;
import com.abba.vpnstore.application.navigation.ScreenRenderer;
import com.abba.vpnstore.application.navigation.Transition;
import com.abba.vpnstore.domain.model.User;
import com.abba.vpnstore.domain.service.LedgerStore;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Static information screens plus the referral link.
 */
@Component
@Order(1100)
public class InfoHandler implements ActionHandler {

    private static final Map<String, MessageKey> PAGES = Map.of(
            Actions.ABOUT, MessageKey.ABOUT_TEXT,
            Actions.HELP, MessageKey.HELP_TEXT,
            Actions.SUPPORT, MessageKey.SUPPORT_TEXT,
            Actions.PROMO, MessageKey.PROMO_UNAVAILABLE
    );

    private final LedgerStore ledgerStore;
    private final ScreenRenderer screenRenderer;

    public InfoHandler(LedgerStore ledgerStore, ScreenRenderer screenRenderer) {
        this.ledgerStore = ledgerStore;
        this.screenRenderer = screenRenderer;
    }

    @Override
    public boolean supports(ActionToken token) {
        return token.args().isEmpty()
                && (PAGES.containsKey(token.verb()) || Actions.REFERRALS.equals(token.verb()));
    }

    @Override
    public Transition handle(ActionContext context) {
        User user = context.requireUser();
        if (Actions.REFERRALS.equals(context.token().verb())) {
            return Transition.to(screenRenderer.referral(user, ledgerStore.countReferrals(user.getId())));
        }
        return Transition.to(screenRenderer.info(user, PAGES.get(context.token().verb())));
    }
}
