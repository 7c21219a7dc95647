package com.abba.vpnstore.application.navigation;

import com.abba.vpnstore.application.navigation.handler.ActionHandler;
import com.abba.vpnstore.domain.exception.UnroutableActionException;
import com.abba.vpnstore.domain.model.User;
import com.abba.vpnstore.domain.service.LedgerStore;
import com.abba.vpnstore.infrastructure.config.StorefrontProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps an inbound action and the stored user to the next screen. Stateless between turns apart
 * from the {@link PendingRegistration} the caller hands back.
 */
@Component
@RequiredArgsConstructor
public class NavigationStateMachine {

    private final List<ActionHandler> handlers;
    private final LedgerStore ledgerStore;
    private final StorefrontProperties storefrontProperties;

    public Transition transition(InboundAction action, PendingRegistration pending) {
        ActionToken token = ActionToken.parse(action.token());
        User user = ledgerStore.getUser(action.identity()).orElse(null);
        ActionContext context = new ActionContext(action, token, user, pending, storefrontProperties.fallbackLanguage());

        for (ActionHandler handler : handlers) {
            if (handler.supports(token)) {
                return handler.handle(context);
            }
        }
        throw new UnroutableActionException("No handler for action " + token);
    }
}
