package com.abba.vpnstore.application.navigation;

import com.abba.vpnstore.domain.exception.UnroutableActionException;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parsed {@code verb[:arg]*} action token, e.g. {@code dur:1:180}.
 */
public record ActionToken(String verb, List<String> args) {

    private static final String SEPARATOR = ":";
    private static final Pattern VERB = Pattern.compile("[a-z_]+");
    private static final int MAX_LENGTH = 64;

    public ActionToken {
        args = List.copyOf(args);
    }

    public static ActionToken parse(String raw) {
        if (raw == null || raw.isBlank() || raw.length() > MAX_LENGTH) {
            throw new UnroutableActionException("Malformed action token: " + raw);
        }
        String[] parts = raw.trim().split(SEPARATOR, -1);
        if (!VERB.matcher(parts[0]).matches()) {
            throw new UnroutableActionException("Malformed action verb: " + raw);
        }
        List<String> args = Arrays.asList(parts).subList(1, parts.length);
        if (args.stream().anyMatch(String::isBlank)) {
            throw new UnroutableActionException("Empty argument in action token: " + raw);
        }
        return new ActionToken(parts[0], args);
    }

    public static String of(String verb, Object... args) {
        StringBuilder token = new StringBuilder(verb);
        for (Object arg : args) {
            token.append(SEPARATOR).append(arg);
        }
        return token.toString();
    }

    public boolean is(String expectedVerb, int arity) {
        return verb.equals(expectedVerb) && args.size() == arity;
    }

    public String arg(int index) {
        return args.get(index);
    }

    public int intArg(int index) {
        try {
            return Integer.parseInt(args.get(index));
        } catch (NumberFormatException e) {
            throw new UnroutableActionException("Argument " + index + " of '" + verb + "' is not a number: " + args.get(index));
        }
    }

    @Override
    public String toString() {
        return args.isEmpty() ? verb : verb + SEPARATOR + String.join(SEPARATOR, args);
    }
}
