package io.b2mash.b2b.datasync.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Per-provider circuit breaker. Only transient provider failures (timeouts, 5xx, 429) count
 * towards the failure rate.
 *
 * @param failureRateThreshold percentage of failed calls in the window that opens the breaker
 * @param slidingWindowSize number of recent calls the failure rate is computed over
 * @param minimumNumberOfCalls calls needed before the failure rate is evaluated
 * @param waitDurationInOpenState how long an open breaker rejects calls before trying again
 * @param permittedCallsInHalfOpenState trial calls allowed while half-open
 */
@ConfigurationProperties(prefix = "datasync.circuit-breaker")
public record CircuitBreakerProperties(
    @DefaultValue("50") float failureRateThreshold,
    @DefaultValue("20") int slidingWindowSize,
    @DefaultValue("10") int minimumNumberOfCalls,
    @DefaultValue("60s") Duration waitDurationInOpenState,
    @DefaultValue("3") int permittedCallsInHalfOpenState) {}
