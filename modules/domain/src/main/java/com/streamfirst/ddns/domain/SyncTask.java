package com.streamfirst.ddns.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * A unit of pending synchronization work: make the fast ledger reflect the record set behind
 * {@code contentRef} for {@code domainKey}. Tasks are immutable; a failed attempt is re-queued as
 * a copy with an incremented retry count.
 */
@Value
@Builder
public class SyncTask {

    /** What produced the task on the authoritative ledger. */
    public enum Kind {
        /** The domain's content reference changed */
        UPDATE,
        /** The domain was registered with a content reference already set */
        REGISTER
    }

    @NonNull Kind kind;

    @NonNull DomainKey domainKey;

    @NonNull ContentRef contentRef;

    /** Authoritative ledger height of the originating event */
    long sourceHeight;

    /** Number of failed apply attempts so far */
    @With int retryCount;

    public static SyncTask update(DomainUpdatedEvent event) {
        return SyncTask.builder()
                .kind(Kind.UPDATE)
                .domainKey(event.domainKey())
                .contentRef(event.contentRef())
                .sourceHeight(event.height())
                .build();
    }

    public static SyncTask register(DomainRegisteredEvent event, ContentRef contentRef) {
        return SyncTask.builder()
                .kind(Kind.REGISTER)
                .domainKey(event.domainKey())
                .contentRef(contentRef)
                .sourceHeight(event.height())
                .build();
    }

    /** Copy of this task for the next attempt after a failure. */
    public SyncTask nextAttempt() {
        return withRetryCount(retryCount + 1);
    }

    @Override
    public String toString() {
        return "SyncTask{" +
               "kind=" + kind +
               ", domainKey=" + domainKey +
               ", contentRef=" + contentRef +
               ", sourceHeight=" + sourceHeight +
               ", retryCount=" + retryCount +
               '}';
    }
}
