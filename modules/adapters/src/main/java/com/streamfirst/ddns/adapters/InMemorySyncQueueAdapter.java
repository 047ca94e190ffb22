package com.streamfirst.ddns.adapters;

import com.streamfirst.ddns.domain.SyncTask;
import com.streamfirst.ddns.ports.EmptyQueueException;
import com.streamfirst.ddns.ports.SyncQueuePort;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of SyncQueuePort.
 * A single lock guards the deque; contention is low because both producer and consumer are
 * interval driven. Queued tasks are lost when the process stops - the sync engine's safety
 * window re-scan recovers them on the next start.
 */
@Slf4j
public class InMemorySyncQueueAdapter implements SyncQueuePort {

    private final Deque<SyncTask> tasks = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public void enqueue(SyncTask task) {
        if (task == null) {
            throw new IllegalArgumentException("Cannot enqueue a null task");
        }
        lock.lock();
        try {
            tasks.addLast(task);
        } finally {
            lock.unlock();
        }
        log.debug("Enqueued {}", task);
    }

    @Override
    public SyncTask dequeue() {
        lock.lock();
        try {
            SyncTask task = tasks.pollFirst();
            if (task == null) {
                throw new EmptyQueueException();
            }
            return task;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return tasks.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gets a copy of the queued tasks, front first. Useful for monitoring and tests.
     */
    public List<SyncTask> snapshot() {
        lock.lock();
        try {
            return List.copyOf(tasks);
        } finally {
            lock.unlock();
        }
    }
}
