package com.abba.vpnstore.application.conversation;

import com.abba.vpnstore.application.dto.InvoiceRequest;
import com.abba.vpnstore.application.navigation.RenderedScreen;

/**
 * Displays screens to a chat. Delivery retries belong to the implementation.
 */
public interface RenderSink {

    /**
     * @param messageId message to replace, or {@code null} to send a new one
     */
    void render(long chatId, Long messageId, RenderedScreen screen);

    void sendInvoice(long chatId, InvoiceRequest invoice);
}
