package com.banklink.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for signing a user in.
 */
@Data
public class OpenSessionRequest {

    @NotBlank(message = "User ID is required")
    @Size(max = 128, message = "User ID must be at most 128 characters")
    private String userId;
}
