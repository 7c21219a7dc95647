package com.abba.vpnstore.application.navigation.handler;

import com.abba.vpnstore.application.navigation.ActionContext;
import com.abba.vpnstore.application.navigation.ActionToken;
import com.abba.vpnstore.application.navigation.Actions;
import com.abba.vpnstore.application.navigation.ScreenRenderer;
import com.abba.vpnstore.application.navigation.Transition;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@code plan:<index>}. An index outside the catalog fails with InvalidSelectionException.
 */
@Component
@Order(700)
public class DurationListHandler implements ActionHandler {

    private final ScreenRenderer screenRenderer;

    public DurationListHandler(ScreenRenderer screenRenderer) {
        this.screenRenderer = screenRenderer;
    }

    @Override
    public boolean supports(ActionToken token) {
        return token.is(Actions.PLAN, 1);
    }

    @Override
    public Transition handle(ActionContext context) {
        return Transition.to(screenRenderer.durationList(context.requireUser(), context.token().intArg(0)));
    }
}
