package com.abba.vpnstore.application.navigation.handler;

import com.abba.vpnstore.application.navigation.ActionContext;
import com.abba.vpnstore.application.navigation.ActionToken;
import com.abba.vpnstore.application.navigation.Actions;
import com.abba.vpnstore.application.navigation.PendingRegistration;
import com.abba.vpnstore.application.navigation.ScreenRenderer;
import com.abba.vpnstore.application.navigation.Transition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry action. Known identities land on the main menu, unknown ones on the language picker
 * with the referrer captured from {@code ref<id>}.
 */
@Slf4j
@Component
@Order(100)
public class StartHandler implements ActionHandler {

    private static final Pattern REFERRAL = Pattern.compile("ref(\\d{1,18})");

    private final ScreenRenderer screenRenderer;

    public StartHandler(ScreenRenderer screenRenderer) {
        this.screenRenderer = screenRenderer;
    }

    @Override
    public boolean supports(ActionToken token) {
        return token.is(Actions.START, 0) || token.is(Actions.START, 1);
    }

    @Override
    public Transition handle(ActionContext context) {
        if (context.isKnownUser()) {
            return Transition.to(screenRenderer.welcomeBack(context.user(), context.displayName()));
        }
        Long referrerId = context.token().args().isEmpty() ? null : referrer(context);
        return new Transition(screenRenderer.languagePick(context.language(), false),
                new PendingRegistration(referrerId), null);
    }

    private Long referrer(ActionContext context) {
        Matcher matcher = REFERRAL.matcher(context.token().arg(0));
        if (!matcher.matches()) {
            log.warn("Ignoring unrecognized start argument identity={} argument={}",
                    context.action().identity(), context.token().arg(0));
            return null;
        }
        long referrerId = Long.parseLong(matcher.group(1));
        if (referrerId == context.action().identity()) {
            log.warn("Ignoring self-referral identity={}", referrerId);
            return null;
        }
        return referrerId;
    }
}
