package io.b2mash.b2b.datasync.ratelimit;

import io.b2mash.b2b.datasync.config.ProvidersProperties;
import io.b2mash.b2b.datasync.integration.Integration;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-integration outbound request budget using fixed windows aligned to the epoch. The window
 * length and budget come from {@code datasync.providers.<provider>.rate-limit}.
 *
 * <p>The budget lives in the database, so it holds across every instance that syncs the same
 * integration.
 */
@Service
public class RateGovernor {

  private static final Logger log = LoggerFactory.getLogger(RateGovernor.class);

  static final ProvidersProperties.RateLimit DEFAULT_LIMIT =
      new ProvidersProperties.RateLimit(1000, Duration.ofHours(1));

  private final RateLimitWindowRepository windowRepository;
  private final ProvidersProperties providersProperties;
  private final Clock clock;

  public RateGovernor(
      RateLimitWindowRepository windowRepository,
      ProvidersProperties providersProperties,
      Clock clock) {
    this.windowRepository = windowRepository;
    this.providersProperties = providersProperties;
    this.clock = clock;
  }

  public boolean tryAcquire(Integration integration) {
    return tryAcquire(integration, 1);
  }

  /**
   * Takes {@code cost} requests from the current window if they fit. A denial changes nothing.
   *
   * @throws IllegalArgumentException if {@code cost} is not positive or exceeds the window limit
   */
  @Transactional
  public boolean tryAcquire(Integration integration, int cost) {
    var limit = limitFor(integration);
    if (cost <= 0 || cost > limit.requests()) {
      throw new IllegalArgumentException(
          "cost must be between 1 and " + limit.requests() + ", got " + cost);
    }
    Instant now = clock.instant();
    Instant windowStart = windowStart(now, limit.window());
    windowRepository.insertIfAbsent(
        integration.getId(), windowStart, windowStart.plus(limit.window()), limit.requests(), now);
    boolean granted =
        windowRepository.incrementWithinLimit(integration.getId(), windowStart, cost) == 1;
    if (!granted) {
      log.debug(
          "Rate limit reached for integration {} in window starting {}",
          integration.getId(),
          windowStart);
    }
    return granted;
  }

  /** Time until the current window closes. Never negative. */
  public Duration waitTime(Integration integration) {
    var limit = limitFor(integration);
    Instant now = clock.instant();
    Duration remaining =
        Duration.between(now, windowStart(now, limit.window()).plus(limit.window()));
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  public RateLimitStatus status(Integration integration) {
    var limit = limitFor(integration);
    Instant start = windowStart(clock.instant(), limit.window());
    return windowRepository
        .findByIntegrationIdAndWindowStart(integration.getId(), start)
        .map(
            w ->
                new RateLimitStatus(
                    w.getWindowStart(),
                    w.getWindowEnd(),
                    w.getRequestsMade(),
                    w.getRequestsLimit()))
        .orElseGet(
            () -> new RateLimitStatus(start, start.plus(limit.window()), 0, limit.requests()));
  }

  ProvidersProperties.RateLimit limitFor(Integration integration) {
    return providersProperties
        .find(integration.getProvider())
        .map(ProvidersProperties.Provider::rateLimit)
        .orElse(DEFAULT_LIMIT);
  }

  static Instant windowStart(Instant now, Duration window) {
    long windowMillis = window.toMillis();
    return Instant.ofEpochMilli(Math.floorDiv(now.toEpochMilli(), windowMillis) * windowMillis);
  }
}
