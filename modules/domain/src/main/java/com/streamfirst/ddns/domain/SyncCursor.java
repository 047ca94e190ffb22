package com.streamfirst.ddns.domain;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Highest authoritative ledger height whose events have been fully ingested. Never moves
 * backwards: a request to move to a lower height is ignored.
 */
public final class SyncCursor {

    private final AtomicLong lastProcessedHeight;

    public SyncCursor(long initialHeight) {
        if (initialHeight < 0) {
            throw new IllegalArgumentException("Height cannot be negative: " + initialHeight);
        }
        this.lastProcessedHeight = new AtomicLong(initialHeight);
    }

    /**
     * Cursor for a freshly started process: the current height minus a safety window, so events
     * missed while the process was down are scanned again. Clamped at zero.
     */
    public static SyncCursor rewoundFrom(long currentHeight, long safetyWindow) {
        return new SyncCursor(Math.max(0L, currentHeight - safetyWindow));
    }

    public long lastProcessedHeight() {
        return lastProcessedHeight.get();
    }

    /**
     * Moves the cursor forward to {@code height}.
     *
     * @return true if the cursor moved, false if it was already at or past {@code height}
     */
    public boolean advanceTo(long height) {
        long current;
        do {
            current = lastProcessedHeight.get();
            if (height <= current) {
                return false;
            }
        } while (!lastProcessedHeight.compareAndSet(current, height));
        return true;
    }

    @Override
    public String toString() {
        return "SyncCursor{lastProcessedHeight=" + lastProcessedHeight.get() + '}';
    }
}
