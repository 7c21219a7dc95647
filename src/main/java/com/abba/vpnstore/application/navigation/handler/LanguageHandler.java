package com.abba.vpnstore.application.navigation.handler;

import com.abba.vpnstore.application.navigation.ActionContext;
import com.abba.vpnstore.application.navigation.ActionToken;
import com.abba.vpnstore.application.navigation.Actions;
import com.abba.vpnstore.application.navigation.ScreenRenderer;
import com.abba.vpnstore.application.navigation.Transition;
import com.abba.vpnstore.domain.exception.InvalidSelectionException;
import com.abba.vpnstore.domain.model.Language;
import com.abba.vpnstore.domain.model.User;
import com.abba.vpnstore.domain.service.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Language choice. Creates the identity on first choice, consuming the pending registration.
 */
@Slf4j
@Component
@Order(200)
public class LanguageHandler implements ActionHandler {

    private final LedgerStore ledgerStore;
    private final ScreenRenderer screenRenderer;
    private final Clock clock;

    public LanguageHandler(LedgerStore ledgerStore, ScreenRenderer screenRenderer, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.screenRenderer = screenRenderer;
        this.clock = clock;
    }

    @Override
    public boolean supports(ActionToken token) {
        return token.is(Actions.LANGUAGE, 1);
    }

    @Override
    public Transition handle(ActionContext context) {
        Language language = Language.fromCode(context.token().arg(0))
                .orElseThrow(() -> new InvalidSelectionException("Unsupported language: " + context.token().arg(0)));
        long identity = context.action().identity();

        if (context.isKnownUser()) {
            User updated = ledgerStore.updateUser(identity, user -> {
                user.setLanguage(language);
                return user.copy();
            });
            return Transition.to(screenRenderer.welcomeBack(updated, context.displayName()));
        }

        Long referrerId = context.pending() == null ? null : context.pending().referrerId();
        User created = ledgerStore.createUser(identity, user -> {
            user.setLanguage(language);
            user.setDisplayName(context.action().displayName());
            user.setUsername(context.action().username());
            user.setReferrerId(referrerId);
            user.setCreatedAt(clock.instant());
        });
        log.info("User registered identity={} language={} referrerId={}", identity, language.code(), referrerId);
        return Transition.to(screenRenderer.welcomeNew(created, context.displayName()));
    }
}
