package com.abba.vpnstore.infrastructure.telegram;

import com.abba.vpnstore.application.conversation.RenderSink;
import com.abba.vpnstore.application.dto.InvoiceRequest;
import com.abba.vpnstore.application.navigation.ActionOption;
import com.abba.vpnstore.application.navigation.RenderedScreen;
import com.abba.vpnstore.infrastructure.config.TelegramProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Bot API calls over OkHttp. Every call posts a JSON body and unwraps the {@code result} field.
 */
@Component
public class TelegramBotClient implements RenderSink {

    private static final Logger log = LoggerFactory.getLogger(TelegramBotClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String PARSE_MODE = "HTML";

    private final TelegramProperties properties;
    private final ObjectMapper objectMapper;
    private final OkHttpClient client;

    public TelegramBotClient(TelegramProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = new OkHttpClient.Builder()
                .readTimeout(Duration.ofSeconds(properties.pollTimeoutSeconds() + 10L))
                .build();
    }

    @Override
    public void render(long chatId, Long messageId, RenderedScreen screen) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("chat_id", chatId);
        body.put("text", screen.text());
        body.put("parse_mode", PARSE_MODE);
        body.set("reply_markup", keyboard(screen.options()));
        if (messageId == null) {
            call("sendMessage", body);
        } else {
            body.put("message_id", messageId);
            call("editMessageText", body);
        }
    }

    @Override
    public void sendInvoice(long chatId, InvoiceRequest invoice) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("chat_id", chatId);
        body.put("title", invoice.title());
        body.put("description", invoice.description());
        body.put("payload", invoice.payload());
        body.put("provider_token", properties.paymentProviderToken());
        body.put("currency", invoice.currency());
        ObjectNode price = body.putArray("prices").addObject();
        price.put("label", invoice.title());
        price.put("amount", invoice.amount());
        call("sendInvoice", body);
    }

    public void answerCallbackQuery(String callbackQueryId, String text) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("callback_query_id", callbackQueryId);
        if (text != null) {
            body.put("text", text);
        }
        call("answerCallbackQuery", body);
    }

    public void answerPreCheckoutQuery(String preCheckoutQueryId, boolean ok) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("pre_checkout_query_id", preCheckoutQueryId);
        body.put("ok", ok);
        call("answerPreCheckoutQuery", body);
    }

    public JsonNode getUpdates(long offset) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("offset", offset);
        body.put("timeout", properties.pollTimeoutSeconds());
        body.putArray("allowed_updates")
                .add("message")
                .add("callback_query")
                .add("pre_checkout_query");
        return call("getUpdates", body);
    }

    public void setWebhook(String url) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("url", url);
        call("setWebhook", body);
    }

    public void deleteWebhook() {
        call("deleteWebhook", objectMapper.createObjectNode());
    }

    private JsonNode call(String method, ObjectNode body) {
        Request request = new Request.Builder()
                .url(properties.botApiUrl(method))
                .post(RequestBody.create(body.toString(), JSON))
                .build();

        try (Response response = client.newCall(request).execute()) {
            String payload = response.body() != null ? response.body().string() : "";
            JsonNode root = payload.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(payload);
            if (!response.isSuccessful() || !root.path("ok").asBoolean(false)) {
                throw new TelegramApiException("Bot API " + method + " failed. status=" + response.code()
                        + " description=" + root.path("description").asText(""));
            }
            return root.path("result");
        } catch (IOException e) {
            log.error("Error calling Bot API method {}", method, e);
            throw new TelegramApiException("Bot API " + method + " failed", e);
        }
    }

    private ObjectNode keyboard(List<List<ActionOption>> options) {
        ObjectNode markup = objectMapper.createObjectNode();
        ArrayNode rows = markup.putArray("inline_keyboard");
        for (List<ActionOption> row : options) {
            ArrayNode buttons = rows.addArray();
            for (ActionOption option : row) {
                buttons.addObject()
                        .put("text", option.label())
                        .put("callback_data", option.token());
            }
        }
        return markup;
    }
}
