package com.banklink.sync;

public enum SyncOutcome {
    COMPLETED,
    SKIPPED_IN_PROGRESS,
    SKIPPED_TOO_SOON,
    SKIPPED_NO_SESSION,
    NO_CONNECTIONS
}
