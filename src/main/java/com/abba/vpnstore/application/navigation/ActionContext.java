package com.abba.vpnstore.application.navigation;

import com.abba.vpnstore.domain.exception.UserNotFoundException;
import com.abba.vpnstore.domain.model.Language;
import com.abba.vpnstore.domain.model.User;

/**
 * Everything a handler needs for one turn.
 *
 * @param user    stored user, {@code null} before the identity has picked a language
 * @param pending registration context handed back by the transport, may be {@code null}
 */
public record ActionContext(InboundAction action, ActionToken token, User user, PendingRegistration pending,
                            Language fallbackLanguage) {

    public boolean isKnownUser() {
        return user != null;
    }

    public User requireUser() {
        if (user == null) {
            throw new UserNotFoundException("Identity " + action.identity() + " has not picked a language yet");
        }
        return user;
    }

    public Language language() {
        if (user != null && user.getLanguage() != null) {
            return user.getLanguage();
        }
        return Language.fromCode(action.languageHint()).orElse(fallbackLanguage);
    }

    public String displayName() {
        if (action.displayName() != null && !action.displayName().isBlank()) {
            return action.displayName();
        }
        return user != null ? user.getDisplayName() : "";
    }
}
