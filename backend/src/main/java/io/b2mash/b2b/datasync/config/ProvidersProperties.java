package io.b2mash.b2b.datasync.config;

import io.b2mash.b2b.datasync.integration.ProviderType;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Per-provider OAuth client registration and outbound rate budget, bound from {@code
 * datasync.providers.<provider>.*}. Client secrets are expected to come from the environment.
 */
@ConfigurationProperties(prefix = "datasync")
public record ProvidersProperties(Map<ProviderType, Provider> providers) {

  public ProvidersProperties {
    providers = providers != null ? Map.copyOf(providers) : Map.of();
  }

  public Optional<Provider> find(ProviderType type) {
    return Optional.ofNullable(providers.get(type));
  }

  /**
   * @param scopeDelimiter separator used when joining scopes into the authorization URL
   * @param extraAuthorizationParams provider-specific query parameters (e.g. {@code
   *     access_type=offline})
   */
  public record Provider(
      String clientId,
      String clientSecret,
      String authorizationUri,
      String tokenUri,
      String revocationUri,
      List<String> scopes,
      @DefaultValue(" ") String scopeDelimiter,
      Map<String, String> extraAuthorizationParams,
      @DefaultValue RateLimit rateLimit) {

    public Provider {
      scopes = scopes != null ? List.copyOf(scopes) : List.of();
      extraAuthorizationParams =
          extraAuthorizationParams != null ? Map.copyOf(extraAuthorizationParams) : Map.of();
    }

    public boolean isConfigured() {
      return clientId != null && !clientId.isBlank() && authorizationUri != null;
    }
  }

  public record RateLimit(
      @DefaultValue("1000") int requests, @DefaultValue("1h") Duration window) {}
}
