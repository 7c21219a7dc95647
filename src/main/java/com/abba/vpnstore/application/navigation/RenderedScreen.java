package com.abba.vpnstore.application.navigation;

import java.util.List;

/**
 * Text and option rows to display. Each inner list is one row of options.
 */
public record RenderedScreen(Screen screen, String text, List<List<ActionOption>> options) {

    public RenderedScreen {
        options = options.stream().map(List::copyOf).toList();
    }

    public List<String> tokens() {
        return options.stream().flatMap(List::stream).map(ActionOption::token).toList();
    }
}
