package com.abba.vpnstore.application.navigation.handler;

import com.abba.vpnstore.application.navigation.ActionContext;
import com.abba.vpnstore.application.navigation.ActionToken;
import com.abba.vpnstore.application.navigation.Transition;

public interface ActionHandler {

    boolean supports(ActionToken token);

    Transition handle(ActionContext context);
}
