package com.streamfirst.ddns.application;

import com.streamfirst.ddns.domain.BatchWrite;
import com.streamfirst.ddns.domain.ContentRef;
import com.streamfirst.ddns.domain.DomainRecordSet;
import com.streamfirst.ddns.domain.DomainRegisteredEvent;
import com.streamfirst.ddns.domain.DomainUpdatedEvent;
import com.streamfirst.ddns.domain.FlattenedRecords;
import com.streamfirst.ddns.domain.RecordSet;
import com.streamfirst.ddns.domain.SyncCursor;
import com.streamfirst.ddns.domain.SyncStats;
import com.streamfirst.ddns.domain.SyncTask;
import com.streamfirst.ddns.domain.WriteConfirmation;
import com.streamfirst.ddns.ports.AuthoritativeLedgerPort;
import com.streamfirst.ddns.ports.EmptyQueueException;
import com.streamfirst.ddns.ports.FastLedgerPort;
import com.streamfirst.ddns.ports.SyncQueuePort;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Synchronizes domain records from the authoritative ledger into the fast ledger. A poll cycle
 * turns ledger events into queued {@link SyncTask}s; an apply cycle drains the queue, fetches each
 * task's record set and writes it to the fast ledger as one batch. Failed applies are re-queued
 * until the retry budget runs out.
 *
 * <p>Both cycles run on their own scheduled task and never throw; failures are logged and counted
 * in {@link #getStats()}.
 */
@Slf4j
@RequiredArgsConstructor
public class SyncOrchestrator {

  static final String FALLBACK_SOURCE = "fallback";

  private final AuthoritativeLedgerPort authoritativeLedger;
  private final FastLedgerPort fastLedger;
  private final SyncQueuePort syncQueue;
  private final ContentResolver contentResolver;
  private final SyncSettings settings;
  private final Clock clock;

  private final AtomicLong eventsProcessed = new AtomicLong();
  private final AtomicLong updatesSynced = new AtomicLong();
  private final AtomicLong fallbackApplies = new AtomicLong();
  private final AtomicLong applyErrors = new AtomicLong();
  private final AtomicLong tasksAbandoned = new AtomicLong();
  private final AtomicLong contentRetrievalErrors = new AtomicLong();
  private final AtomicLong pollErrors = new AtomicLong();

  // dequeued tasks by attempt; whoever removes an entry owns the task
  private final Map<Long, SyncTask> inFlight = new ConcurrentHashMap<>();
  private final AtomicLong attempts = new AtomicLong();
  private final Object pollLock = new Object();

  private volatile SyncCursor cursor;
  private volatile ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pollCycle;
  private volatile ScheduledFuture<?> applyCycle;
  private volatile Instant startedAt;
  private volatile boolean running;
  private volatile boolean stopRequested;

  /**
   * Starts the poll and apply cycles. The first start positions the cursor a safety window behind
   * the current authoritative height; a restart resumes from where the previous run stopped.
   *
   * @return true if the cycles were scheduled, false if already running or the authoritative
   *     height could not be read
   */
  public synchronized boolean start() {
    if (running) {
      log.warn("Sync engine is already running");
      return false;
    }

    long head;
    try {
      head = authoritativeLedger.currentHeight();
    } catch (Exception e) {
      log.error("Failed to read authoritative height, sync engine not started", e);
      return false;
    }

    synchronized (pollLock) {
      if (cursor == null) {
        cursor = SyncCursor.rewoundFrom(head, settings.getSafetyWindow());
        log.info(
            "Starting sync at height {} (head {}, safety window {})",
            cursor.lastProcessedHeight(),
            head,
            settings.getSafetyWindow());
      } else {
        log.info("Resuming sync from height {} (head {})", cursor.lastProcessedHeight(), head);
      }
    }

    stopRequested = false;
    AtomicInteger threads = new AtomicInteger();
    scheduler =
        Executors.newScheduledThreadPool(
            2,
            r -> {
              Thread thread = new Thread(r, "ddns-sync-" + threads.incrementAndGet());
              thread.setDaemon(true);
              return thread;
            });
    long pollMillis = settings.getPollInterval().toMillis();
    long applyMillis = settings.getApplyInterval().toMillis();
    pollCycle =
        scheduler.scheduleWithFixedDelay(
            this::runPollCycle, pollMillis, pollMillis, TimeUnit.MILLISECONDS);
    applyCycle =
        scheduler.scheduleWithFixedDelay(
            this::runApplyCycle, applyMillis, applyMillis, TimeUnit.MILLISECONDS);
    startedAt = clock.instant();
    running = true;
    return true;
  }

  /**
   * Reads ledger events between the cursor and the current head and queues the resulting tasks.
   * The cursor only moves once every read for the range has succeeded, so a failed poll is
   * repeated in full by the next one.
   *
   * @return number of tasks queued
   */
  public int pollOnce() {
    synchronized (pollLock) {
      try {
        long head = authoritativeLedger.currentHeight();
        SyncCursor current = cursorFor(head);
        long last = current.lastProcessedHeight();
        if (head <= last) {
          log.debug("No new blocks since height {}", last);
          return 0;
        }

        long from = last + 1;
        List<DomainUpdatedEvent> updates = authoritativeLedger.queryUpdateEvents(from, head);
        List<DomainRegisteredEvent> registrations =
            authoritativeLedger.queryRegisterEvents(from, head);

        List<SyncTask> tasks = new ArrayList<>(updates.size() + registrations.size());
        for (DomainUpdatedEvent event : updates) {
          tasks.add(SyncTask.update(event));
        }
        for (DomainRegisteredEvent event : registrations) {
          DomainRecordSet record = authoritativeLedger.getDomainRecord(event.domainKey());
          if (record.getContentRef().isPresent()) {
            tasks.add(SyncTask.register(event, record.getContentRef()));
          } else {
            log.debug("Domain {} registered without content, nothing to sync", event.domainKey());
          }
        }

        tasks.forEach(syncQueue::enqueue);
        eventsProcessed.addAndGet(updates.size() + registrations.size());
        current.advanceTo(head);

        log.info(
            "Processed {} update and {} registration events in blocks {}-{}, queued {} tasks",
            updates.size(),
            registrations.size(),
            from,
            head,
            tasks.size());
        return tasks.size();
      } catch (Exception e) {
        pollErrors.incrementAndGet();
        log.error("Error polling authoritative ledger for events", e);
        return 0;
      }
    }
  }

  /**
   * Applies up to {@code applyBatchSize} queued tasks to the fast ledger. Once a stop is requested
   * no further task is taken off the queue.
   *
   * @return number of tasks applied successfully
   */
  public int applyOnce() {
    int applied = 0;
    for (int i = 0; i < settings.getApplyBatchSize(); i++) {
      if (stopRequested) {
        log.debug("Stop requested, leaving {} tasks queued", syncQueue.size());
        break;
      }
      SyncTask task;
      try {
        task = syncQueue.dequeue();
      } catch (EmptyQueueException e) {
        break;
      }

      long attempt = attempts.incrementAndGet();
      inFlight.put(attempt, task);
      try {
        applyTask(task);
        inFlight.remove(attempt);
        updatesSynced.incrementAndGet();
        applied++;
      } catch (IllegalArgumentException e) {
        applyErrors.incrementAndGet();
        abandonRejectedTask(attempt, task, e);
      } catch (Exception e) {
        applyErrors.incrementAndGet();
        handleFailedApply(attempt, task, e);
      }
    }
    return applied;
  }

  private void applyTask(SyncTask task) {
    log.debug("Applying {}", task);

    RecordSet recordSet = contentResolver.resolveOrFallback(task.getContentRef());
    boolean degraded = !recordSet.isReliable();
    if (degraded) {
      contentRetrievalErrors.incrementAndGet();
    }

    FlattenedRecords records = recordSet.flatten();
    if (degraded) {
      records =
          records.plus(
              settings.getProvenanceRecordType(), FALLBACK_SOURCE, recordSet.effectiveTtl());
    }
    if (records.isEmpty()) {
      log.info("Record set for {} is empty, nothing to write", task.getDomainKey());
      return;
    }

    // placeholder data is written without provenance so verification never trusts it
    ContentRef writtenRef = degraded ? ContentRef.NONE : task.getContentRef();
    FastLedgerPort.PendingWrite pending =
        fastLedger.submitBatchWrite(BatchWrite.of(task.getDomainKey(), writtenRef, records));
    log.debug("Submitted transaction {} for {}", pending.transactionId(), task.getDomainKey());

    WriteConfirmation confirmation = pending.awaitConfirmations(settings.getConfirmations());
    if (degraded) {
      fallbackApplies.incrementAndGet();
    }
    log.info(
        "Synced {} records for domain {} in transaction {} (block {})",
        records.size(),
        task.getDomainKey(),
        confirmation.transactionId(),
        confirmation.height());
  }

  // a malformed write fails the same way every time
  private void abandonRejectedTask(long attempt, SyncTask task, IllegalArgumentException error) {
    if (inFlight.remove(attempt) == null) {
      log.debug("Task {} was already returned to the queue on stop", task);
      return;
    }
    tasksAbandoned.incrementAndGet();
    log.error("Abandoning {}, fast ledger rejected the write", task, error);
  }

  private void handleFailedApply(long attempt, SyncTask task, Exception error) {
    if (inFlight.remove(attempt) == null) {
      log.debug("Task {} was already returned to the queue on stop", task);
      return;
    }
    if (stopRequested) {
      syncQueue.enqueue(task);
      log.info("Returned {} to the queue after failure during shutdown", task);
      return;
    }
    if (task.getRetryCount() < settings.getMaxRetries()) {
      SyncTask retry = task.nextAttempt();
      syncQueue.enqueue(retry);
      log.warn(
          "Failed to apply {}, re-queued (attempt {} of {}): {}",
          task,
          retry.getRetryCount(),
          settings.getMaxRetries(),
          error.getMessage());
    } else {
      tasksAbandoned.incrementAndGet();
      log.error("Abandoning {} after {} failed attempts", task, task.getRetryCount() + 1, error);
    }
  }

  /**
   * Cancels both cycles and waits up to the shutdown grace period for a running one to finish.
   * Tasks dequeued but not applied go back on the queue with their retry count unchanged.
   *
   * @return true if both cycles stopped within the grace period, or the engine was not running
   */
  public synchronized boolean stop() {
    if (!running) {
      log.debug("Sync engine is not running");
      return true;
    }

    log.info("Stopping sync engine");
    stopRequested = true;
    pollCycle.cancel(false);
    applyCycle.cancel(false);
    scheduler.shutdown();

    boolean clean;
    try {
      clean =
          scheduler.awaitTermination(settings.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      clean = false;
    }
    if (!clean) {
      log.warn("Sync cycles did not finish within {}, interrupting", settings.getShutdownGrace());
      scheduler.shutdownNow();
    }

    int returned = returnInFlightTasks();
    running = false;
    log.info(
        "Sync engine stopped at height {}, {} tasks returned, {} tasks queued",
        cursor.lastProcessedHeight(),
        returned,
        syncQueue.size());
    return clean;
  }

  private int returnInFlightTasks() {
    int returned = 0;
    for (Long attempt : List.copyOf(inFlight.keySet())) {
      SyncTask task = inFlight.remove(attempt);
      if (task != null) {
        syncQueue.enqueue(task);
        returned++;
      }
    }
    return returned;
  }

  public boolean isRunning() {
    return running;
  }

  public SyncStats getStats() {
    SyncCursor current = cursor;
    Instant started = startedAt;
    return SyncStats.builder()
        .eventsProcessed(eventsProcessed.get())
        .updatesSynced(updatesSynced.get())
        .fallbackApplies(fallbackApplies.get())
        .applyErrors(applyErrors.get())
        .tasksAbandoned(tasksAbandoned.get())
        .contentRetrievalErrors(contentRetrievalErrors.get())
        .pollErrors(pollErrors.get())
        .lastProcessedHeight(current == null ? 0L : current.lastProcessedHeight())
        .queueSize(syncQueue.size())
        .inFlight(inFlight.size())
        .running(running)
        .uptime(running && started != null ? Duration.between(started, clock.instant()) : Duration.ZERO)
        .build();
  }

  private SyncCursor cursorFor(long head) {
    SyncCursor current = cursor;
    if (current == null) {
      current = SyncCursor.rewoundFrom(head, settings.getSafetyWindow());
      cursor = current;
    }
    return current;
  }

  private void runPollCycle() {
    try {
      pollOnce();
    } catch (Exception e) {
      log.error("Unexpected error in poll cycle", e);
    }
  }

  private void runApplyCycle() {
    try {
      applyOnce();
    } catch (Exception e) {
      log.error("Unexpected error in apply cycle", e);
    }
  }
}
