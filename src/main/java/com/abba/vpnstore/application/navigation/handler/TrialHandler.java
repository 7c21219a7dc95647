package com.abba.vpnstore.application.navigation.handler;

import com.abba.vpnstore.application.navigation.ActionContext;
import com.abba.vpnstore.application.navigation.ActionToken;
import com.abba.vpnstore.application.navigation.Actions;
import com.abba.vpnstore.application.navigation.ScreenRenderer;
import com.abba.vpnstore.application.navigation.Transition;
import com.abba.vpnstore.domain.exception.AlreadyGrantedException;
import com.abba.vpnstore.domain.model.TrialGrant;
import com.abba.vpnstore.domain.model.User;
import com.abba.vpnstore.domain.service.EntitlementService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@Order(500)
public class TrialHandler implements ActionHandler {

    private final EntitlementService entitlementService;
    private final ScreenRenderer screenRenderer;

    public TrialHandler(EntitlementService entitlementService, ScreenRenderer screenRenderer) {
        this.entitlementService = entitlementService;
        this.screenRenderer = screenRenderer;
    }

    @Override
    public boolean supports(ActionToken token) {
        return token.is(Actions.TRIAL, 0);
    }

    @Override
    public Transition handle(ActionContext context) {
        User user = context.requireUser();
        try {
            TrialGrant grant = entitlementService.grantTrial(user.getId());
            return Transition.to(screenRenderer.trialActivated(user, grant));
        } catch (AlreadyGrantedException e) {
            log.info("Trial requested again identity={}", user.getId());
            return Transition.to(screenRenderer.trialUsed(user));
        }
    }
}
