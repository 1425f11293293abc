package com.axlabs.neo.timelock;

import com.axlabs.neo.timelock.runtime.StorageContext;
import com.axlabs.neo.timelock.runtime.StorageMap;
import io.neow3j.types.Hash256;

/**
 * The set of queued action fingerprints. An absent entry reads as not queued, so an action that was never queued
 * and one that was executed or cancelled look the same.
 */
class QueuedTransactions {

    static final byte QUEUED_PREFIX = 1;

    private final StorageMap queued; // [Hash256 fingerprint: boolean queued]

    QueuedTransactions(StorageContext ctx) {
        this.queued = new StorageMap(ctx, QUEUED_PREFIX);
    }

    boolean isQueued(Hash256 fingerprint) {
        return queued.getBoolean(fingerprint.toArray());
    }

    void set(Hash256 fingerprint, boolean isQueued) {
        queued.put(fingerprint.toArray(), isQueued);
    }
}
