package com.banklink.oauth;

import java.util.regex.Pattern;

/**
 * Format rules for provider authorization codes, shared by the callback
 * handler and the broker.
 */
public final class AuthorizationCodes {

    private static final Pattern FORMAT = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final int MIN_LENGTH = 20;
    private static final int MAX_LENGTH = 200;

    private AuthorizationCodes() {
    }

    public static boolean isValidFormat(String code) {
        return code != null
            && code.length() >= MIN_LENGTH
            && code.length() <= MAX_LENGTH
            && FORMAT.matcher(code).matches();
    }
}
