package io.b2mash.b2b.datasync.integration.provider;

import io.b2mash.b2b.datasync.integration.ProviderType;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Indexes the {@link ProviderClient} beans by provider. Two adapters for the same provider fail
 * start-up. Resolved clients call through the provider's circuit breaker, so a provider that keeps
 * failing is left alone for a while instead of being hit by every job.
 */
@Component
public class ProviderRegistry {

  private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

  private final Map<ProviderType, ProviderClient> clients = new EnumMap<>(ProviderType.class);

  public ProviderRegistry(
      ObjectProvider<ProviderClient> providerClients,
      CircuitBreakerRegistry circuitBreakerRegistry) {
    for (ProviderClient client : providerClients.orderedStream().toList()) {
      var existing = clients.putIfAbsent(client.provider(), client);
      if (existing != null) {
        throw new IllegalStateException(
            "Duplicate ProviderClient for "
                + client.provider()
                + ": registered by both "
                + existing.getClass().getName()
                + " and "
                + client.getClass().getName());
      }
    }
    clients.replaceAll(
        (type, client) ->
            new CircuitBreakingProviderClient(
                client, circuitBreaker(circuitBreakerRegistry, type)));
    log.info("Registered provider clients: {}", clients.keySet());
  }

  private static CircuitBreaker circuitBreaker(CircuitBreakerRegistry registry, ProviderType type) {
    var breaker = registry.circuitBreaker("provider-" + type.getSlug());
    breaker
        .getEventPublisher()
        .onStateTransition(
            event ->
                log.warn(
                    "Circuit breaker for {} moved {}",
                    type.getSlug(),
                    event.getStateTransition()));
    return breaker;
  }

  /** Returns the adapter for {@code provider}, or throws a 422 when none is registered. */
  public ProviderClient resolve(ProviderType provider) {
    var client = clients.get(provider);
    if (client == null) {
      throw new ProviderNotConfiguredException(provider);
    }
    return client;
  }

  public boolean isRegistered(ProviderType provider) {
    return clients.containsKey(provider);
  }

  public Set<ProviderType> registeredProviders() {
    return Set.copyOf(clients.keySet());
  }
}
