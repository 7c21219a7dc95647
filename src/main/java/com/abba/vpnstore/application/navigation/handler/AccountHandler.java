package com.abba.vpnstore.application.navigation.handler;

import com.abba.vpnstore.application.navigation.ActionContext;
import com.abba.vpnstore.application.navigation.ActionToken;
import com.abba.vpnstore.application.navigation.Actions;
import com.abba.vpnstore.application.navigation.ScreenRenderer;
import com.abba.vpnstore.application.navigation.Transition;
import com.abba.vpnstore.domain.model.User;
import com.abba.vpnstore.domain.service.LedgerStore;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1000)
public class AccountHandler implements ActionHandler {

    private final LedgerStore ledgerStore;
    private final ScreenRenderer screenRenderer;

    public AccountHandler(LedgerStore ledgerStore, ScreenRenderer screenRenderer) {
        this.ledgerStore = ledgerStore;
        this.screenRenderer = screenRenderer;
    }

    @Override
    public boolean supports(ActionToken token) {
        return token.is(Actions.ACCOUNT, 0);
    }

    @Override
    public Transition handle(ActionContext context) {
        User user = context.requireUser();
        return Transition.to(screenRenderer.account(user, ledgerStore.countReferrals(user.getId())));
    }
}
