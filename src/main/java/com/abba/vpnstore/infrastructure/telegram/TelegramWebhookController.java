package com.abba.vpnstore.infrastructure.telegram;

import com.abba.vpnstore.infrastructure.config.TelegramProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/webhooks/telegram")
public class TelegramWebhookController {

    private static final Logger log = LoggerFactory.getLogger(TelegramWebhookController.class);

    private final TelegramProperties props;
    private final TelegramUpdateDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    public TelegramWebhookController(TelegramProperties props,
                                     TelegramUpdateDispatcher dispatcher,
                                     ObjectMapper objectMapper) {
        this.props = props;
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
    }

    @PostMapping(path = "/{secret}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Void> receive(@PathVariable String secret,
                                        @RequestBody(required = false) String body) {
        if (!props.enabled()) {
            log.info("[Telegram disabled] Received webhook POST body length={}", body == null ? 0 : body.length());
            return ResponseEntity.ok().build();
        }
        if (!props.webhookSecret().equals(secret)) {
            log.warn("Ignoring Telegram webhook with invalid secret");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        if (body == null || body.isBlank()) {
            log.warn("Empty webhook body");
            return ResponseEntity.ok().build();
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            dispatcher.dispatch(root);
        } catch (Exception e) {
            log.error("Failed to process Telegram webhook: {}", e.getMessage(), e);
        }
        return ResponseEntity.ok().build();
    }
}
