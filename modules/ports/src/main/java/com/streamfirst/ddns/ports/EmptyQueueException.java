package com.streamfirst.ddns.ports;

import java.util.NoSuchElementException;

/**
 * Raised by {@link SyncQueuePort#dequeue()} when there is nothing to dequeue.
 */
public class EmptyQueueException extends NoSuchElementException {

    public EmptyQueueException() {
        super("Sync queue is empty");
    }
}
