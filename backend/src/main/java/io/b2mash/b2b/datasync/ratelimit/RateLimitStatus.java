package io.b2mash.b2b.datasync.ratelimit;

import java.time.Instant;

/** Snapshot of the current window, for diagnostics. */
public record RateLimitStatus(
    Instant windowStart, Instant windowEnd, int requestsMade, int requestsLimit) {

  public int remaining() {
    return Math.max(0, requestsLimit - requestsMade);
  }
}
