package com.abba.vpnstore.application.navigation.handler;

import com.abba.vpnstore.application.navigation.ActionContext;
import com.abba.vpnstore.application.navigation.ActionToken;
import com.abba.vpnstore.application.navigation.Actions;
import com.abba.vpnstore.application.navigation.ScreenRenderer;
import com.abba.vpnstore.application.navigation.Transition;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(400)
public class MainMenuHandler implements ActionHandler {

    private final ScreenRenderer screenRenderer;

    public MainMenuHandler(ScreenRenderer screenRenderer) {
        this.screenRenderer = screenRenderer;
    }

    @Override
    public boolean supports(ActionToken token) {
        return token.is(Actions.MENU, 0) || token.is(Actions.BACK, 0);
    }

    @Override
    public Transition handle(ActionContext context) {
        return Transition.to(screenRenderer.welcomeBack(context.requireUser(), context.displayName()));
    }
}
