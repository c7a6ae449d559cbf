package com.banklink.api.dto;

import lombok.Data;

/**
 * Query parameters of the consent callback, forwarded by the app.
 * Either {@code code} and {@code state}, or {@code error}.
 */
@Data
public class CallbackRequest {
    private String code;
    private String state;
    private String error;

    @Override
    public String toString() {
        return "CallbackRequest(error=" + error + ")";
    }
}
