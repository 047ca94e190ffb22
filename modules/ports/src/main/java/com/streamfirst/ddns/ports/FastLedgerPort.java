package com.streamfirst.ddns.ports;

import com.streamfirst.ddns.domain.*;

import java.util.List;

/**
 * Port for the fast (L2) ledger: a low-latency, low-trust ledger holding flattened DNS-style
 * records, written only by the bridge.
 */
public interface FastLedgerPort {

    /**
     * Reads one record type of a domain.
     *
     * @param domainKey the domain
     * @param type the record type
     * @return the record, {@link FastRecord#empty()} if the ledger holds nothing for it
     * @throws LedgerUnavailableException if the read fails
     */
    FastRecord getRecord(DomainKey domainKey, String type);

    /**
     * Reads several record types of a domain in one round trip.
     *
     * @param domainKey the domain
     * @param types the record types, in the order results should be returned
     * @return one slot per requested type
     * @throws LedgerUnavailableException if the read fails
     */
    FastBatch getBatchRecords(DomainKey domainKey, List<String> types);

    /**
     * Submits an atomic write of all record types of a domain. The write replaces everything the
     * ledger held for the domain, types it leaves out included, so resubmitting the same write is
     * harmless.
     *
     * @param write the records to write
     * @return a handle to wait for confirmations on
     * @throws IllegalArgumentException if the write is malformed (never retried)
     * @throws LedgerUnavailableException if the write cannot be submitted
     */
    PendingWrite submitBatchWrite(BatchWrite write);

    /**
     * A submitted write that may not be durable yet.
     */
    interface PendingWrite {

        /** Identifier of the submitted write. */
        String transactionId();

        /**
         * Blocks until the write has {@code depth} confirmations.
         *
         * @param depth number of confirmations required
         * @return the confirmation receipt
         * @throws LedgerUnavailableException if the write was dropped or reverted
         */
        WriteConfirmation awaitConfirmations(int depth);
    }
}
