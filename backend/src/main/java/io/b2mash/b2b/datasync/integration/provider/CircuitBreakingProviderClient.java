package io.b2mash.b2b.datasync.integration.provider;

import io.b2mash.b2b.datasync.integration.ProviderType;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.time.Duration;
import java.util.function.Supplier;

/** Routes every outbound call of one adapter through that provider's circuit breaker. */
final class CircuitBreakingProviderClient implements ProviderClient {

  private final ProviderClient delegate;
  private final CircuitBreaker circuitBreaker;

  CircuitBreakingProviderClient(ProviderClient delegate, CircuitBreaker circuitBreaker) {
    this.delegate = delegate;
    this.circuitBreaker = circuitBreaker;
  }

  ProviderClient delegate() {
    return delegate;
  }

  CircuitBreaker circuitBreaker() {
    return circuitBreaker;
  }

  @Override
  public ProviderType provider() {
    return delegate.provider();
  }

  @Override
  public TokenGrant exchangeCode(String code, String redirectUri) {
    return call(() -> delegate.exchangeCode(code, redirectUri));
  }

  @Override
  public TokenRefreshResult refreshToken(String refreshToken) {
    return call(() -> delegate.refreshToken(refreshToken));
  }

  @Override
  public FetchedPage fetchPage(String accessToken, FetchRequest request, String cursor) {
    return call(() -> delegate.fetchPage(accessToken, request, cursor));
  }

  @Override
  public boolean supportsRevocation() {
    return delegate.supportsRevocation();
  }

  @Override
  public void revoke(String token) {
    call(
        () -> {
          delegate.revoke(token);
          return null;
        });
  }

  private <T> T call(Supplier<T> call) {
    try {
      return circuitBreaker.executeSupplier(call);
    } catch (CallNotPermittedException e) {
      throw new ProviderUnavailableException(delegate.provider(), retryAfter());
    }
  }

  private Duration retryAfter() {
    return Duration.ofMillis(
        circuitBreaker.getCircuitBreakerConfig().getWaitIntervalFunctionInOpenState().apply(1));
  }
}
