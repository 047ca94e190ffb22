package com.streamfirst.ddns.domain;

import java.util.Objects;

/**
 * "Content updated" event observed on the authoritative ledger.
 *
 * @param domainKey the domain whose content reference changed
 * @param contentRef the new content reference
 * @param height ledger height at which the change was recorded
 */
public record DomainUpdatedEvent(DomainKey domainKey, ContentRef contentRef, long height) {
    public DomainUpdatedEvent {
        Objects.requireNonNull(domainKey, "Domain key cannot be null");
        Objects.requireNonNull(contentRef, "Content reference cannot be null");
    }
}
