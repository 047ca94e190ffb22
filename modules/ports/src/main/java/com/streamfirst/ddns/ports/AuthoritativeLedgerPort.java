package com.streamfirst.ddns.ports;

import com.streamfirst.ddns.domain.*;

import java.util.List;

/**
 * Port for the authoritative (L1) ledger: the slow, trusted registry of domain ownership and
 * content pointers. The bridge only reads from it; writes happen through the ledger's own
 * governance path.
 */
public interface AuthoritativeLedgerPort {

    /**
     * Gets the current head height of the ledger.
     *
     * @return the latest height
     * @throws LedgerUnavailableException if the ledger cannot be reached
     */
    long currentHeight();

    /**
     * Gets all "content updated" events recorded between two heights.
     *
     * @param fromHeight first height to include
     * @param toHeight last height to include
     * @return events ordered by height
     * @throws LedgerUnavailableException if the query fails
     */
    List<DomainUpdatedEvent> queryUpdateEvents(long fromHeight, long toHeight);

    /**
     * Gets all "newly registered" events recorded between two heights.
     *
     * @param fromHeight first height to include
     * @param toHeight last height to include
     * @return events ordered by height
     * @throws LedgerUnavailableException if the query fails
     */
    List<DomainRegisteredEvent> queryRegisterEvents(long fromHeight, long toHeight);

    /**
     * Reads the current authoritative record of a domain.
     *
     * @param domainKey the domain to read
     * @return the record, {@link DomainRecordSet#unregistered()} if nobody owns the domain
     * @throws LedgerUnavailableException if the read fails
     */
    DomainRecordSet getDomainRecord(DomainKey domainKey);
}
