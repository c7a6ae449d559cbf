package com.banklink.oauth;

import com.banklink.common.exception.InvalidInputException;
import lombok.Value;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Parsed deep-link callback:
 * {@code <app-scheme>://<callback-host>?code=..&state=..} or {@code ?error=..}.
 */
@Value
public class CallbackUri {
    String code;
    String state;
    String error;
    String errorDescription;

    /**
     * @throws InvalidInputException if the scheme is not allowed or the host differs
     */
    public static CallbackUri parse(String uri, List<String> allowedSchemes, String expectedHost) {
        if (uri == null || uri.isBlank()) {
            throw new InvalidInputException("Callback URI is required");
        }
        UriComponents components;
        try {
            components = UriComponentsBuilder.fromUriString(uri).build();
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Callback URI is malformed");
        }
        if (components.getScheme() == null || !allowedSchemes.contains(components.getScheme())) {
            throw new InvalidInputException("Callback scheme is not allowed");
        }
        if (!expectedHost.equals(components.getHost())) {
            throw new InvalidInputException("Callback host does not match");
        }
        var params = components.getQueryParams();
        return new CallbackUri(
            decode(params.getFirst("code")),
            decode(params.getFirst("state")),
            decode(params.getFirst("error")),
            decode(params.getFirst("error_description")));
    }

    private static String decode(String value) {
        return value == null ? null : UriUtils.decode(value, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "CallbackUri(error=" + error + ")";
    }
}
