package com.streamfirst.ddns.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * Stable ledger identifier of a domain: the Keccak-256 hash of its name, rendered as 0x-prefixed
 * lowercase hex. Both ledgers and the content index address domains only by this key, never by
 * name.
 *
 * @param hex the 0x-prefixed hash (e.g., "0x1111...1111")
 */
public record DomainKey(String hex) {
    public DomainKey {
        Objects.requireNonNull(hex, "Domain key cannot be null");
        if (!hex.startsWith("0x") || hex.length() < 3) {
            throw new IllegalArgumentException("Domain key must be 0x-prefixed hex: " + hex);
        }
        hex = hex.toLowerCase(Locale.ROOT);
    }

    public static DomainKey of(String hex) {
        return new DomainKey(hex);
    }

    @Override
    public String toString() {
        return hex;
    }
}
