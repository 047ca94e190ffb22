package com.streamfirst.ddns.application;

import java.time.Duration;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Tuning of the sync engine. Defaults match the production bridge deployment. */
@Value
@Builder(toBuilder = true)
public class SyncSettings {

  /** Delay between two poll cycles */
  @NonNull @Builder.Default Duration pollInterval = Duration.ofSeconds(30);

  /** Delay between two apply cycles */
  @NonNull @Builder.Default Duration applyInterval = Duration.ofSeconds(1);

  /** Tasks applied per apply cycle */
  @Builder.Default int applyBatchSize = 1;

  /** Re-queues allowed after a failed apply before the task is abandoned */
  @Builder.Default int maxRetries = 5;

  /** Fast-ledger confirmations a batch write needs before it counts as durable */
  @Builder.Default int confirmations = 3;

  /** Heights re-scanned behind the current head when the engine starts */
  @Builder.Default long safetyWindow = 10_000L;

  /** How long stop waits for a running cycle to finish */
  @NonNull @Builder.Default Duration shutdownGrace = Duration.ofSeconds(5);

  /** Record type written alongside placeholder record sets to mark them */
  @NonNull @Builder.Default String provenanceRecordType = "_source";

  public static SyncSettings defaults() {
    return SyncSettings.builder().build();
  }
}
