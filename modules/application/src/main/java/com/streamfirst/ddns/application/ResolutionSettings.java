package com.streamfirst.ddns.application;

import java.time.Duration;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Default resolution policy; individual queries may override parts of it. */
@Value
@Builder(toBuilder = true)
public class ResolutionSettings {

  @Builder.Default boolean cacheEnabled = true;

  /** Consult the fast tier first unless a query forces a tier */
  @Builder.Default boolean preferFast = true;

  /** Cross-check fast answers against the authoritative tier */
  @Builder.Default boolean verifyWithAuthoritative = false;

  /** Upper bound on a single tier call; zero disables the bound */
  @NonNull @Builder.Default Duration tierTimeout = Duration.ofSeconds(2);

  /** Caps how long an answer is cached, null to cache for the record's own ttl */
  Duration maxCacheTtl;

  public static ResolutionSettings defaults() {
    return ResolutionSettings.builder().build();
  }
}
