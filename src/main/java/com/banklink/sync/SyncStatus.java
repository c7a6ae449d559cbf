package com.banklink.sync;

import lombok.Value;

import java.time.Instant;

@Value
public class SyncStatus {
    SyncState state;
    Instant lastSyncAt;
    SyncReport lastReport;
}
