package com.streamfirst.ddns.domain;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time snapshot of the sync engine's counters.
 */
@Value
@Builder
public class SyncStats {
    /** Sync tasks created from observed ledger events */
    long eventsProcessed;
    /** Tasks whose batch write reached the confirmation depth */
    long updatesSynced;
    /** Successful writes that carried a placeholder record set */
    long fallbackApplies;
    /** Failed apply attempts, retried or not */
    long applyErrors;
    /** Tasks dropped after exhausting the retry budget */
    long tasksAbandoned;
    /** Content decode or fetch failures that forced a placeholder record set */
    long contentRetrievalErrors;
    /** Poll cycles that failed and left the cursor where it was */
    long pollErrors;
    long lastProcessedHeight;
    int queueSize;
    /** Tasks dequeued but not yet applied */
    int inFlight;
    boolean running;
    Duration uptime;

    /** Every error the engine has counted. */
    public long totalErrors() {
        return applyErrors + contentRetrievalErrors + pollErrors;
    }
}
