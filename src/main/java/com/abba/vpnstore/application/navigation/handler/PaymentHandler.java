package com.abba.vpnstore.application.navigation.handler;

import com.abba.vpnstore.application.catalog.PlanCatalog;
import com.abba.vpnstore.application.dto.InvoiceRequest;
import com.abba.vpnstore.application.dto.PurchaseResult;
import com.abba.vpnstore.application.dto.PurchaseSelection;
import com.abba.vpnstore.application.navigation.ActionContext;
import com.abba.vpnstore.application.navigation.ActionToken;
import com.abba.vpnstore.application.navigation.Actions;
import com.abba.vpnstore.application.navigation.ScreenRenderer;
import com.abba.vpnstore.application.navigation.Transition;
import com.abba.vpnstore.domain.exception.InvalidSelectionException;
import com.abba.vpnstore.domain.model.PaymentMethod;
import com.abba.vpnstore.domain.model.User;
import com.abba.vpnstore.domain.service.LedgerStore;
import com.abba.vpnstore.domain.service.PaymentIntakeService;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@code pay:<method>:<index>:<days>}. Gateway methods open an invoice and wait for the completion
 * event, demo methods complete on the spot.
 */
@Component
@Order(900)
public class PaymentHandler implements ActionHandler {

    private final PlanCatalog planCatalog;
    private final PaymentIntakeService paymentIntakeService;
    private final LedgerStore ledgerStore;
    private final ScreenRenderer screenRenderer;

    public PaymentHandler(PlanCatalog planCatalog,
                          PaymentIntakeService paymentIntakeService,
                          LedgerStore ledgerStore,
                          ScreenRenderer screenRenderer) {
        this.planCatalog = planCatalog;
        this.paymentIntakeService = paymentIntakeService;
        this.ledgerStore = ledgerStore;
        this.screenRenderer = screenRenderer;
    }

    @Override
    public boolean supports(ActionToken token) {
        return token.is(Actions.PAY, 3);
    }

    @Override
    public Transition handle(ActionContext context) {
        User user = context.requireUser();
        PaymentMethod method = PaymentMethod.fromCode(context.token().arg(0))
                .orElseThrow(() -> new InvalidSelectionException("Unsupported payment method: " + context.token().arg(0)));
        PurchaseSelection selection = new PurchaseSelection(context.token().intArg(1), context.token().intArg(2));
        planCatalog.price(selection.planIndex(), selection.durationDays());

        if (method.isGateway()) {
            InvoiceRequest invoice = paymentIntakeService.prepareInvoice(user, selection);
            return new Transition(screenRenderer.paymentPending(user, selection), null, invoice);
        }

        PurchaseResult result = paymentIntakeService.completeDemoPayment(user.getId(), selection, method);
        User refreshed = ledgerStore.getUser(user.getId()).orElse(user);
        return Transition.to(screenRenderer.paymentResult(refreshed, result));
    }
}
