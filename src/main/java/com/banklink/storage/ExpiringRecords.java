package com.banklink.storage;

/**
 * A family of secure-tier records that carry their own expiry.
 */
public interface ExpiringRecords {

    /**
     * Delete records past their expiry, and records that can no longer be read.
     *
     * @return number of records deleted
     */
    int purgeExpired();
}
