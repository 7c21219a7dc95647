package com.abba.vpnstore.infrastructure.telegram;

import com.abba.vpnstore.application.conversation.ConversationService;
import com.abba.vpnstore.application.conversation.TurnOutcome;
import com.abba.vpnstore.application.dto.InvoiceRequest;
import com.abba.vpnstore.application.navigation.InboundAction;
import com.abba.vpnstore.application.navigation.PendingRegistration;
import com.abba.vpnstore.application.navigation.RenderedScreen;
import com.abba.vpnstore.application.navigation.Screen;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TelegramUpdateDispatcherTest {

    private static final RenderedScreen PICKER = new RenderedScreen(Screen.LANGUAGE_PICK, "pick", List.of());
    private static final RenderedScreen MENU = new RenderedScreen(Screen.MAIN_MENU, "menu", List.of());

    @Mock
    private ConversationService conversationService;

    @Mock
    private TelegramBotClient botClient;

    private final AtomicLong nanos = new AtomicLong();

    private TelegramUpdateDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new TelegramUpdateDispatcher(new TelegramUpdateParser(), conversationService, botClient, nanos::get);
    }

    @Test
    void pendingRegistrationIsHandedBackExactlyOnce() {
        PendingRegistration pending = new PendingRegistration(42L);
        InboundAction start = new InboundAction(100L, "start:ref42", "Ana", null, null);
        InboundAction pick = new InboundAction(100L, "lang:en", "Ana", null, null);
        when(conversationService.onAction(start, null)).thenReturn(TurnOutcome.screen(PICKER, pending));
        when(conversationService.onAction(pick, pending)).thenReturn(TurnOutcome.screen(MENU, null));

        dispatcher.dispatch(TelegramUpdate.action(1, 100L, null, null, start));
        assertThat(dispatcher.pendingRegistrations()).containsEntry(100L, pending);

        dispatcher.dispatch(TelegramUpdate.action(2, 100L, 9L, "cb-1", pick));

        assertThat(dispatcher.pendingRegistrations()).isEmpty();
        verify(botClient).render(100L, null, PICKER);
        verify(botClient).render(100L, 9L, MENU);
        verify(botClient).answerCallbackQuery("cb-1", null);
    }

    @Test
    void noticeAnswersCallbackWithoutRendering() {
        InboundAction stale = new InboundAction(100L, "plan:9", "Ana", null, null);
        when(conversationService.onAction(stale, null)).thenReturn(TurnOutcome.notice("gone", null));

        dispatcher.dispatch(TelegramUpdate.action(3, 100L, 9L, "cb-2", stale));

        verify(botClient).answerCallbackQuery("cb-2", "gone");
        verify(botClient, never()).render(anyLong(), any(), any());
    }

    @Test
    void invoiceIsSentAfterPendingScreen() {
        InboundAction pay = new InboundAction(100L, "pay:stars:0:30", "Ana", null, null);
        InvoiceRequest invoice = new InvoiceRequest("t", "d", "plan_0_dur_30", "XTR", 500L);
        RenderedScreen pendingScreen = new RenderedScreen(Screen.PAYMENT_PENDING, "pending", List.of());
        when(conversationService.onAction(pay, null)).thenReturn(new TurnOutcome(pendingScreen, null, invoice, null));

        dispatcher.dispatch(TelegramUpdate.action(4, 100L, 9L, "cb-3", pay));

        verify(botClient).render(100L, 9L, pendingScreen);
        verify(botClient).sendInvoice(100L, invoice);
    }

    @Test
    void preCheckoutIsAnswered() {
        when(conversationService.onPreCheckout(100L, "plan_0_dur_30")).thenReturn(true);

        dispatcher.dispatch(TelegramUpdate.preCheckout(5, 100L, "pq-1", "plan_0_dur_30"));

        verify(botClient).answerPreCheckoutQuery("pq-1", true);
    }

    @Test
    void completedPaymentSendsNewMessage() {
        RenderedScreen result = new RenderedScreen(Screen.PAYMENT_RESULT, "paid", List.of());
        when(conversationService.onPaymentCompleted(100L, "plan_0_dur_30", "XTR", "tg-1"))
                .thenReturn(TurnOutcome.screen(result, null));

        dispatcher.dispatch(TelegramUpdate.paymentCompleted(6, 100L, 100L, "plan_0_dur_30", "XTR", "tg-1"));

        verify(botClient).render(eq(100L), isNull(), eq(result));
    }

    @Test
    void deliveryFailureDoesNotEscape() {
        InboundAction menu = new InboundAction(100L, "menu", "Ana", null, null);
        when(conversationService.onAction(menu, null)).thenReturn(TurnOutcome.screen(MENU, null));
        doThrow(new TelegramApiException("blocked by user")).when(botClient).render(100L, null, MENU);

        assertThatCode(() -> dispatcher.dispatch(TelegramUpdate.action(7, 100L, null, null, menu)))
                .doesNotThrowAnyException();
    }

    @Test
    void abandonedRegistrationExpires() {
        PendingRegistration pending = new PendingRegistration(42L);
        InboundAction start = new InboundAction(100L, "start:ref42", "Ana", null, null);
        InboundAction pick = new InboundAction(100L, "lang:en", "Ana", null, null);
        when(conversationService.onAction(start, null)).thenReturn(TurnOutcome.screen(PICKER, pending));
        when(conversationService.onAction(pick, null)).thenReturn(TurnOutcome.screen(MENU, null));

        dispatcher.dispatch(TelegramUpdate.action(1, 100L, null, null, start));
        nanos.addAndGet(TelegramUpdateDispatcher.PENDING_REGISTRATION_TTL.plusSeconds(1).toNanos());

        assertThat(dispatcher.pendingRegistrations()).doesNotContainKey(100L);

        dispatcher.dispatch(TelegramUpdate.action(2, 100L, 9L, "cb-1", pick));

        verify(conversationService).onAction(pick, null);
    }

    @Test
    void pendingRegistrationsStayBoundedWhenChatsNeverReturn() {
        when(conversationService.onAction(any(InboundAction.class), isNull()))
                .thenAnswer(invocation -> TurnOutcome.screen(PICKER, new PendingRegistration(null)));
        long chats = TelegramUpdateDispatcher.PENDING_REGISTRATION_LIMIT + 1_000;

        for (long chatId = 1; chatId <= chats; chatId++) {
            dispatcher.dispatch(TelegramUpdate.action(chatId, chatId, null, null,
                    new InboundAction(chatId, "start", "Ana", null, null)));
        }

        assertThat(dispatcher.pendingRegistrationCount())
                .isLessThanOrEqualTo(TelegramUpdateDispatcher.PENDING_REGISTRATION_LIMIT);
    }
}
