package com.banklink.broker;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the code-for-token exchange. Format checks are done by the broker
 * itself so every rejection is audited with its reason.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExchangeTokenRequest {
    private String code;
    private String redirectUri;
    private String state;

    @Override
    public String toString() {
        return "ExchangeTokenRequest(redirectUri=" + redirectUri + ")";
    }
}
