package io.b2mash.b2b.datasync.config;

import io.b2mash.b2b.datasync.integration.provider.ProviderPermanentException;
import io.b2mash.b2b.datasync.integration.provider.ProviderTransientException;
import io.b2mash.b2b.datasync.integration.provider.ProviderUnauthorizedException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ResilienceConfig {

  private static final Logger log = LoggerFactory.getLogger(ResilienceConfig.class);

  @Bean
  public CircuitBreakerRegistry providerCircuitBreakerRegistry(
      CircuitBreakerProperties properties) {
    log.info(
        "Provider circuit breakers open at {}% failures over {} calls, for {}",
        properties.failureRateThreshold(),
        properties.slidingWindowSize(),
        properties.waitDurationInOpenState());
    return CircuitBreakerRegistry.of(providerCircuitBreakerConfig(properties));
  }

  /** Rejected tokens and bad requests say nothing about the provider's health. */
  public static CircuitBreakerConfig providerCircuitBreakerConfig(
      CircuitBreakerProperties properties) {
    return CircuitBreakerConfig.custom()
        .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
        .failureRateThreshold(properties.failureRateThreshold())
        .slidingWindowSize(properties.slidingWindowSize())
        .minimumNumberOfCalls(properties.minimumNumberOfCalls())
        .waitDurationInOpenState(properties.waitDurationInOpenState())
        .permittedNumberOfCallsInHalfOpenState(properties.permittedCallsInHalfOpenState())
        .recordExceptions(ProviderTransientException.class)
        .ignoreExceptions(ProviderUnauthorizedException.class, ProviderPermanentException.class)
        .build();
  }
}
