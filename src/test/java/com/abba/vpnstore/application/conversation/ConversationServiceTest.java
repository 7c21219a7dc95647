package com.abba.vpnstore.application.conversation;

import com.abba.vpnstore.StorefrontFixture;
import com.abba.vpnstore.application.dto.GatewayCompletion;
import com.abba.vpnstore.application.navigation.InboundAction;
import com.abba.vpnstore.application.navigation.NavigationStateMachine;
import com.abba.vpnstore.application.navigation.PendingRegistration;
import com.abba.vpnstore.application.navigation.Screen;
import com.abba.vpnstore.domain.exception.InvalidSelectionException;
import com.abba.vpnstore.domain.exception.PaymentIntegrityException;
import com.abba.vpnstore.domain.exception.PersistenceFailureException;
import com.abba.vpnstore.domain.exception.UnroutableActionException;
import com.abba.vpnstore.domain.exception.UserNotFoundException;
import com.abba.vpnstore.domain.model.Language;
import com.abba.vpnstore.domain.model.User;
import com.abba.vpnstore.domain.service.LedgerStore;
import com.abba.vpnstore.domain.service.PaymentIntakeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversationServiceTest {

    @Mock
    private NavigationStateMachine navigation;

    @Mock
    private PaymentIntakeService paymentIntakeService;

    @Mock
    private LedgerStore ledgerStore;

    private final StorefrontFixture fixture = new StorefrontFixture();
    private ConversationService conversation;

    @BeforeEach
    void setUp() {
        conversation = new ConversationService(navigation, paymentIntakeService, fixture.screenRenderer, ledgerStore,
                fixture.storefrontProperties);
    }

    @Nested
    @DisplayName("Navigation failures")
    class NavigationFailures {

        private final PendingRegistration pending = new PendingRegistration(5L);

        @Test
        void staleSelectionKeepsScreenAndPendingRegistration() {
            when(ledgerStore.getUser(1L)).thenReturn(Optional.of(user(1L, Language.EN)));
            when(navigation.transition(any(), any())).thenThrow(new InvalidSelectionException("plan 9"));

            TurnOutcome outcome = conversation.onAction(action("plan:9"), pending);

            assertThat(outcome.rendersScreen()).isFalse();
            assertThat(outcome.notice()).isEqualTo("This option is no longer available.");
            assertThat(outcome.pendingRegistration()).isEqualTo(pending);
        }

        @Test
        void unroutableTokenIsANotice() {
            when(ledgerStore.getUser(1L)).thenReturn(Optional.empty());
            when(navigation.transition(any(), any())).thenThrow(new UnroutableActionException("teleport"));

            TurnOutcome outcome = conversation.onAction(action("teleport"), pending);

            assertThat(outcome.screen()).isNull();
            assertThat(outcome.notice()).isNotBlank();
        }

        @Test
        void unregisteredIdentityIsSentToLanguagePick() {
            when(ledgerStore.getUser(1L)).thenReturn(Optional.empty());
            when(navigation.transition(any(), any())).thenThrow(new UserNotFoundException("not registered"));

            TurnOutcome outcome = conversation.onAction(action("menu"), pending);

            assertThat(outcome.screen().screen()).isEqualTo(Screen.LANGUAGE_PICK);
            assertThat(outcome.pendingRegistration()).isEqualTo(pending);
        }

        @Test
        void storeOutageRendersGenericFailure() {
            when(ledgerStore.getUser(1L)).thenThrow(new PersistenceFailureException("down", new RuntimeException()));

            TurnOutcome outcome = conversation.onAction(action("menu"), null);

            assertThat(outcome.screen().screen()).isEqualTo(Screen.FAILURE);
            assertThat(outcome.screen().tokens()).containsExactly("menu");
            verifyNoInteractions(navigation);
        }

        @Test
        void paymentIntegrityFailureRendersPaymentFailed() {
            when(ledgerStore.getUser(1L)).thenReturn(Optional.of(user(1L, Language.EN)));
            when(navigation.transition(any(), any()))
                    .thenThrow(new PaymentIntegrityException("rolled back", new RuntimeException()));

            TurnOutcome outcome = conversation.onAction(action("pay:card:0:30"), null);

            assertThat(outcome.screen().text()).contains("Payment could not be completed");
        }

        @Test
        void blockedUserIsIgnored() {
            User blocked = user(1L, Language.EN);
            blocked.setBlocked(true);
            when(ledgerStore.getUser(1L)).thenReturn(Optional.of(blocked));

            TurnOutcome outcome = conversation.onAction(action("menu"), null);

            assertThat(outcome).isEqualTo(TurnOutcome.ignored(null));
            verifyNoInteractions(navigation);
        }
    }

    @Nested
    @DisplayName("Gateway completion")
    class GatewayCompletionTurns {

        @Test
        void duplicateConfirmationRendersMainMenu() {
            when(paymentIntakeService.completeGatewayPayment(1L, "plan_0_dur_30", "XTR", "ch-1"))
                    .thenReturn(GatewayCompletion.alreadyRecorded());
            when(ledgerStore.getUser(1L)).thenReturn(Optional.of(user(1L, Language.EN)));

            TurnOutcome outcome = conversation.onPaymentCompleted(1L, "plan_0_dur_30", "XTR", "ch-1");

            assertThat(outcome.screen().screen()).isEqualTo(Screen.MAIN_MENU);
        }

        @Test
        void integrityFailureRendersPaymentFailed() {
            when(paymentIntakeService.completeGatewayPayment(1L, "plan_0_dur_30", "XTR", "ch-1"))
                    .thenThrow(new PaymentIntegrityException("rolled back", new RuntimeException()));

            TurnOutcome outcome = conversation.onPaymentCompleted(1L, "plan_0_dur_30", "XTR", "ch-1");

            assertThat(outcome.screen().screen()).isEqualTo(Screen.FAILURE);
            assertThat(outcome.screen().text()).contains("Payment could not be completed");
        }

        @Test
        void preCheckoutIsDelegated() {
            when(paymentIntakeService.acknowledgePreCheckout(1L, "plan_0_dur_30")).thenReturn(true);

            assertThat(conversation.onPreCheckout(1L, "plan_0_dur_30")).isTrue();
        }
    }

    @Test
    @DisplayName("End to end over the in-memory ledger: gateway invoice then confirmation")
    void gatewayFlowOverInMemoryLedger() {
        ConversationService wired = fixture.conversation;
        wired.onAction(new InboundAction(7L, "lang:en", "Kim", "kim", "en"), null);

        TurnOutcome invoice = wired.onAction(new InboundAction(7L, "pay:stars:0:30", "Kim", "kim", "en"), null);
        TurnOutcome paid = wired.onPaymentCompleted(7L, invoice.invoice().payload(), "XTR", "ch-7");
        TurnOutcome repeated = wired.onPaymentCompleted(7L, invoice.invoice().payload(), "XTR", "ch-7");

        assertThat(invoice.screen().screen()).isEqualTo(Screen.PAYMENT_PENDING);
        assertThat(paid.screen().screen()).isEqualTo(Screen.PAYMENT_RESULT);
        assertThat(paid.screen().text()).contains("vless://paid-7@demo.server:443");
        assertThat(repeated.screen().screen()).isEqualTo(Screen.MAIN_MENU);
        assertThat(fixture.ledgerStore.findPayments(7L)).hasSize(1);
    }

    @Test
    void confirmationWithoutChargeIdShowsPaymentFailedAndRecordsNothing() {
        ConversationService wired = fixture.conversation;
        wired.onAction(new InboundAction(8L, "lang:en", "Kim", "kim", "en"), null);

        TurnOutcome paid = wired.onPaymentCompleted(8L, "plan_0_dur_30", "XTR", null);

        assertThat(paid.screen().screen()).isEqualTo(Screen.FAILURE);
        assertThat(paid.screen().text()).contains("Payment could not be completed");
        assertThat(fixture.ledgerStore.findSubscriptions(8L)).isEmpty();
        assertThat(fixture.ledgerStore.findPayments(8L)).isEmpty();
        assertThat(fixture.user(8L).getSubscriptionEnd()).isNull();
    }

    private static InboundAction action(String token) {
        return new InboundAction(1L, token, "Alex", "alex", "en");
    }

    private static User user(long id, Language language) {
        User user = new User();
        user.setId(id);
        user.setLanguage(language);
        user.setDisplayName("Alex");
        return user;
    }
}
