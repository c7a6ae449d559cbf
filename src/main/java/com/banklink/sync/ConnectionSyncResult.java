package com.banklink.sync;

import com.banklink.common.exception.ErrorCategory;
import lombok.Value;

/**
 * Result of syncing one connection. {@code failure} is null on success.
 */
@Value
public class ConnectionSyncResult {
    String connectionId;
    int accounts;
    int accountsWithErrors;
    ErrorCategory failure;

    public boolean isSuccess() {
        return failure == null;
    }
}
