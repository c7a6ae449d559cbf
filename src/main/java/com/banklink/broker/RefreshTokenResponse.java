package com.banklink.broker;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RefreshTokenResponse {
    private String accessToken;
    private String refreshToken;
    private long expiresIn;

    @Override
    public String toString() {
        return "RefreshTokenResponse(expiresIn=" + expiresIn + ")";
    }
}
