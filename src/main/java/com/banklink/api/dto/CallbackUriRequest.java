package com.banklink.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Raw deep link received by the app.
 */
@Data
public class CallbackUriRequest {

    @NotBlank(message = "Callback URI is required")
    @Size(max = 2048, message = "Callback URI is too long")
    private String uri;

    @Override
    public String toString() {
        return "CallbackUriRequest()";
    }
}
