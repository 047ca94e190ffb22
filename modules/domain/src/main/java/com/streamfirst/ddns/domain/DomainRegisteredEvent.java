package com.streamfirst.ddns.domain;

import java.util.Objects;

/**
 * "Newly registered" event observed on the authoritative ledger. Registration carries no content;
 * the current content reference has to be read from the domain record.
 *
 * @param domainKey the registered domain
 * @param owner the registrant
 * @param height ledger height at which the registration was recorded
 */
public record DomainRegisteredEvent(DomainKey domainKey, String owner, long height) {
    public DomainRegisteredEvent {
        Objects.requireNonNull(domainKey, "Domain key cannot be null");
    }
}
