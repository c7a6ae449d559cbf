package com.banklink.broker;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RefreshTokenRequest {
    private String refreshToken;
    private String connectionId;

    @Override
    public String toString() {
        return "RefreshTokenRequest(connectionId=" + connectionId + ")";
    }
}
