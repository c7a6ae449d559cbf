package com.banklink.sync;

/**
 * Whether a full sync is currently running.
 */
public enum SyncState {
    IDLE,
    RUNNING
}
