package com.streamfirst.ddns.application;

import java.time.Duration;

/** Raised when a call to one resolution tier does not complete within its time bound. */
public class TierTimeoutException extends RuntimeException {

  public TierTimeoutException(String tier, Duration timeout) {
    super(tier + " tier call timed out after " + timeout.toMillis() + "ms");
  }
}
