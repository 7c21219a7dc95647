package com.abba.vpnstore.domain.service;

import com.abba.vpnstore.application.dto.GatewayCompletion;
import com.abba.vpnstore.application.dto.InvoiceRequest;
import com.abba.vpnstore.application.dto.PurchaseResult;
import com.abba.vpnstore.application.dto.PurchaseSelection;
import com.abba.vpnstore.domain.model.PaymentMethod;
import com.abba.vpnstore.domain.model.User;

public interface PaymentIntakeService {

    PurchaseResult completeDemoPayment(long userId, PurchaseSelection selection, PaymentMethod method);

    InvoiceRequest prepareInvoice(User user, PurchaseSelection selection);

    boolean acknowledgePreCheckout(long userId, String payload);

    GatewayCompletion completeGatewayPayment(long userId, String payload, String currency, String externalReference);
}
