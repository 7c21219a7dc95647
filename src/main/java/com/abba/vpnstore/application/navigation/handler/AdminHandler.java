package com.abba.vpnstore.application.navigation.handler;

import com.abba.vpnstore.application.navigation.ActionContext;
import com.abba.vpnstore.application.navigation.ActionToken;
import com.abba.vpnstore.application.navigation.Actions;
import com.abba.vpnstore.application.navigation.ScreenRenderer;
import com.abba.vpnstore.application.navigation.Transition;
import com.abba.vpnstore.domain.exception.UnroutableActionException;
import com.abba.vpnstore.domain.model.User;
import com.abba.vpnstore.domain.service.LedgerStore;
import com.abba.vpnstore.infrastructure.config.StorefrontProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Slf4j
@Component
@Order(1200)
public class AdminHandler implements ActionHandler {

    private final LedgerStore ledgerStore;
    private final ScreenRenderer screenRenderer;
    private final StorefrontProperties storefrontProperties;
    private final Clock clock;

    public AdminHandler(LedgerStore ledgerStore,
                        ScreenRenderer screenRenderer,
                        StorefrontProperties storefrontProperties,
                        Clock clock) {
        this.ledgerStore = ledgerStore;
        this.screenRenderer = screenRenderer;
        this.storefrontProperties = storefrontProperties;
        this.clock = clock;
    }

    @Override
    public boolean supports(ActionToken token) {
        return token.is(Actions.ADMIN, 0);
    }

    @Override
    public Transition handle(ActionContext context) {
        User user = context.requireUser();
        if (!storefrontProperties.isAdmin(user.getId())) {
            log.warn("Admin panel requested by non-operator identity={}", user.getId());
            throw new UnroutableActionException("Admin panel is restricted to operators");
        }
        return Transition.to(screenRenderer.admin(user, ledgerStore.statistics(clock.instant())));
    }
}
