package com.streamfirst.ddns.ports;

import com.streamfirst.ddns.domain.RecordSet;

import java.util.Optional;

/**
 * Port for the content-addressed store that holds full record sets.
 */
public interface ContentStorePort {

    /**
     * Fetches the record set stored under a locator.
     *
     * @param locator content-store address (e.g., an IPFS CID)
     * @return the record set, empty if nothing is stored under the locator
     * @throws ContentStoreException if the store cannot be reached
     * @throws RecordSetFormatException if the stored document is not a valid record set
     */
    Optional<RecordSet> fetch(String locator);
}
