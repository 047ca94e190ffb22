package com.streamfirst.ddns.domain;

/**
 * Which tier produced a resolution result.
 */
public enum ResolutionSource {
    /** Served from the local resolution cache */
    CACHE,
    /** Read from the fast (L2) ledger */
    FAST,
    /** Read from the authoritative (L1) ledger and the content store */
    AUTHORITATIVE,
    /** Every tier consulted failed */
    ERROR
}
