package com.banklink.api.dto;

import com.banklink.oauth.LinkState;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class FlowStateResponse {
    private LinkState state;
}
