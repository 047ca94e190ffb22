package com.streamfirst.ddns.application;

import lombok.Builder;
import lombok.Value;

/**
 * Per-query overrides of the resolution policy.
 */
@Value
@Builder
public class ResolveOptions {

  public static final ResolveOptions DEFAULTS = ResolveOptions.builder().build();

  /** Read only the authoritative tier */
  boolean forceAuthoritative;

  /** Read only the fast tier, without falling back */
  boolean forceFast;

  /** Ignore cached answers (the result is still cached) */
  boolean skipCache;

  /** Verify against the authoritative tier; null uses the configured default */
  Boolean verify;

  public boolean verifyOr(boolean fallback) {
    return verify != null ? verify : fallback;
  }
}
