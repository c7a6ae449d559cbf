package com.banklink.api.dto;

import com.banklink.session.SessionState;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SessionResponse {
    private SessionState state;
    private boolean signedIn;
}
