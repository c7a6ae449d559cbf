package com.banklink.connections;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.regex.Pattern;

/**
 * Connection identifier format: {@code tl_<epochMillis>_<9 base36 chars>}.
 */
public final class ConnectionIds {

    private static final Pattern FORMAT = Pattern.compile("^tl_[A-Za-z0-9_]+$");
    private static final String BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 9;
    private static final int MIN_LENGTH = 10;
    private static final int MAX_LENGTH = 100;

    private ConnectionIds() {
    }

    public static String generate(Clock clock, SecureRandom random) {
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(BASE36.charAt(random.nextInt(BASE36.length())));
        }
        return "tl_" + clock.millis() + "_" + suffix;
    }

    public static boolean isValid(String connectionId) {
        return connectionId != null
            && connectionId.length() >= MIN_LENGTH
            && connectionId.length() <= MAX_LENGTH
            && FORMAT.matcher(connectionId).matches();
    }

    /**
     * Log-safe form: first 8 characters only.
     */
    public static String shorten(String connectionId) {
        if (connectionId == null) {
            return "null";
        }
        return connectionId.length() <= 8 ? connectionId : connectionId.substring(0, 8) + "...";
    }
}
