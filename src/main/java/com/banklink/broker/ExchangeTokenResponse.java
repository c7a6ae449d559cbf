package com.banklink.broker;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExchangeTokenResponse {
    private String connectionId;
    private String accessToken;
    private String refreshToken;
    /**
     * Access token lifetime in seconds.
     */
    private long expiresIn;

    @Override
    public String toString() {
        return "ExchangeTokenResponse(connectionId=" + connectionId + ", expiresIn=" + expiresIn + ")";
    }
}
