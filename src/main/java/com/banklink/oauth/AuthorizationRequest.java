package com.banklink.oauth;

import lombok.Value;

/**
 * Authorization URL to open in the provider's consent UI, with the state it embeds.
 */
@Value
public class AuthorizationRequest {
    String url;
    String state;
}
