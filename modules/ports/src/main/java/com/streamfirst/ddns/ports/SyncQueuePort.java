package com.streamfirst.ddns.ports;

import com.streamfirst.ddns.domain.SyncTask;

/**
 * Port for the work queue between event ingestion and apply. First in, first out; no priorities
 * and no deduplication, so several tasks for the same domain may be queued at once.
 * Implementations must tolerate concurrent enqueue and dequeue.
 */
public interface SyncQueuePort {

    /**
     * Appends a task at the back of the queue.
     *
     * @param task the task to append
     */
    void enqueue(SyncTask task);

    /**
     * Removes and returns the task at the front of the queue.
     *
     * @return the oldest queued task
     * @throws EmptyQueueException if the queue is empty
     */
    SyncTask dequeue();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}
