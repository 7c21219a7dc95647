package com.abba.vpnstore.application.navigation.handler;

import com.abba.vpnstore.application.catalog.PlanCatalog;
import com.abba.vpnstore.application.dto.PurchaseSelection;
import com.abba.vpnstore.application.navigation.ActionContext;
import com.abba.vpnstore.application.navigation.ActionToken;
import com.abba.vpnstore.application.navigation.Actions;
import com.abba.vpnstore.application.navigation.ScreenRenderer;
import com.abba.vpnstore.application.navigation.Transition;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@code dur:<index>:<days>}.
 */
@Component
@Order(800)
public class PaymentMethodHandler implements ActionHandler {

    private final PlanCatalog planCatalog;
    private final ScreenRenderer screenRenderer;

    public PaymentMethodHandler(PlanCatalog planCatalog, ScreenRenderer screenRenderer) {
        this.planCatalog = planCatalog;
        this.screenRenderer = screenRenderer;
    }

    @Override
    public boolean supports(ActionToken token) {
        return token.is(Actions.DURATION, 2);
    }

    @Override
    public Transition handle(ActionContext context) {
        PurchaseSelection selection = new PurchaseSelection(context.token().intArg(0), context.token().intArg(1));
        planCatalog.price(selection.planIndex(), selection.durationDays());
        return Transition.to(screenRenderer.paymentMethods(context.requireUser(), selection));
    }
}
