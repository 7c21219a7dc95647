package com.abba.vpnstore.application.conversation;

import com.abba.vpnstore.application.dto.GatewayCompletion;
import com.abba.vpnstore.application.i18n.MessageKey;
import com.abba.vpnstore.application.navigation.InboundAction;
import com.abba.vpnstore.application.navigation.NavigationStateMachine;
import com.abba.vpnstore.application.navigation.PendingRegistration;
import com.abba.vpnstore.application.navigation.ScreenRenderer;
import com.abba.vpnstore.domain.exception.InvalidSelectionException;
import com.abba.vpnstore.domain.exception.PaymentIntegrityException;
import com.abba.vpnstore.domain.exception.PersistenceFailureException;
import com.abba.vpnstore.domain.exception.UnroutableActionException;
import com.abba.vpnstore.domain.exception.UserNotFoundException;
import com.abba.vpnstore.domain.model.Language;
import com.abba.vpnstore.domain.model.User;
import com.abba.vpnstore.domain.service.LedgerStore;
import com.abba.vpnstore.domain.service.PaymentIntakeService;
import com.abba.vpnstore.infrastructure.config.StorefrontProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * One turn per inbound event. Every storefront failure is turned into a screen or a notice here so
 * a failing session never propagates past the transport.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConversationService {

    private final NavigationStateMachine navigationStateMachine;
    private final PaymentIntakeService paymentIntakeService;
    private final ScreenRenderer screenRenderer;
    private final LedgerStore ledgerStore;
    private final StorefrontProperties storefrontProperties;

    public TurnOutcome onAction(InboundAction action, PendingRegistration pending) {
        Language language = languageOf(null, action.languageHint());
        try {
            Optional<User> stored = ledgerStore.getUser(action.identity());
            if (stored.map(User::isBlocked).orElse(false)) {
                log.info("Ignoring action from blocked identity={}", action.identity());
                return TurnOutcome.ignored(pending);
            }
            language = languageOf(stored.orElse(null), action.languageHint());
            return TurnOutcome.of(navigationStateMachine.transition(action, pending));
        } catch (UnroutableActionException | InvalidSelectionException e) {
            log.warn("Rejected action identity={} token={} reason={}", action.identity(), action.token(), e.getMessage());
            return TurnOutcome.notice(screenRenderer.notice(language, MessageKey.ACTION_UNAVAILABLE), pending);
        } catch (UserNotFoundException e) {
            log.info("Action before registration identity={} token={}", action.identity(), action.token());
            return TurnOutcome.screen(screenRenderer.languagePick(language, false), pending);
        } catch (PaymentIntegrityException e) {
            log.error("Payment integrity failure identity={} token={}", action.identity(), action.token(), e);
            return TurnOutcome.screen(screenRenderer.paymentFailed(language), pending);
        } catch (PersistenceFailureException e) {
            log.error("Ledger unavailable identity={} token={}", action.identity(), action.token(), e);
            return TurnOutcome.screen(screenRenderer.failure(language), pending);
        }
    }

    public boolean onPreCheckout(long identity, String payload) {
        return paymentIntakeService.acknowledgePreCheckout(identity, payload);
    }

    public TurnOutcome onPaymentCompleted(long identity, String payload, String currency, String externalReference) {
        Language language = storefrontProperties.fallbackLanguage();
        try {
            GatewayCompletion completion = paymentIntakeService.completeGatewayPayment(
                    identity, payload, currency, externalReference);
            User user = ledgerStore.getUser(identity)
                    .orElseThrow(() -> new UserNotFoundException("Paid identity " + identity + " is not registered"));
            if (completion.duplicate()) {
                return TurnOutcome.screen(screenRenderer.welcomeBack(user, user.getDisplayName()), null);
            }
            return TurnOutcome.screen(screenRenderer.paymentResult(user, completion.purchase()), null);
        } catch (PaymentIntegrityException | InvalidSelectionException | UserNotFoundException e) {
            log.error("Gateway payment needs operator follow-up identity={} payload={} externalReference={}",
                    identity, payload, externalReference, e);
            return TurnOutcome.screen(screenRenderer.paymentFailed(language), null);
        } catch (PersistenceFailureException e) {
            log.error("Ledger unavailable while recording payment identity={} externalReference={}",
                    identity, externalReference, e);
            return TurnOutcome.screen(screenRenderer.failure(language), null);
        }
    }

    private Language languageOf(User user, String hint) {
        if (user != null && user.getLanguage() != null) {
            return user.getLanguage();
        }
        return Language.fromCode(hint).orElse(storefrontProperties.fallbackLanguage());
    }
}
