package com.banklink.sync;

import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class SyncReport {
    SyncOutcome outcome;
    Instant startedAt;
    Instant finishedAt;
    List<ConnectionSyncResult> connections;

    public static SyncReport skipped(SyncOutcome outcome, Instant now) {
        return new SyncReport(outcome, now, now, List.of());
    }
}
