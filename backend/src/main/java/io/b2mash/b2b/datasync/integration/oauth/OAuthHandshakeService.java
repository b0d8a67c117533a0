package io.b2mash.b2b.datasync.integration.oauth;

import io.b2mash.b2b.datasync.audit.AuditEventBuilder;
import io.b2mash.b2b.datasync.audit.AuditService;
import io.b2mash.b2b.datasync.config.OAuthProperties;
import io.b2mash.b2b.datasync.config.ProvidersProperties;
import io.b2mash.b2b.datasync.exception.InvalidStateException;
import io.b2mash.b2b.datasync.integration.Integration;
import io.b2mash.b2b.datasync.integration.ProviderType;
import io.b2mash.b2b.datasync.integration.credential.CredentialStore;
import io.b2mash.b2b.datasync.integration.provider.ProviderException;
import io.b2mash.b2b.datasync.integration.provider.ProviderNotConfiguredException;
import io.b2mash.b2b.datasync.integration.provider.ProviderRegistry;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Drives the OAuth 2.0 authorization-code handshake: issues single-use state tokens, builds the
 * provider's consent URL and turns the callback into a stored {@link Integration}.
 *
 * <p>The state is consumed in its own committed transaction before the code exchange, so a
 * replayed or concurrent duplicate callback is rejected even while the first one is still talking
 * to the provider.
 */
@Service
public class OAuthHandshakeService {

  private static final Logger log = LoggerFactory.getLogger(OAuthHandshakeService.class);

  private static final int STATE_BYTES = 32;

  private final OAuthStateRepository stateRepository;
  private final ProviderRegistry providerRegistry;
  private final ProvidersProperties providersProperties;
  private final OAuthProperties oauthProperties;
  private final CredentialStore credentialStore;
  private final AuditService auditService;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;
  private final SecureRandom secureRandom = new SecureRandom();

  public OAuthHandshakeService(
      OAuthStateRepository stateRepository,
      ProviderRegistry providerRegistry,
      ProvidersProperties providersProperties,
      OAuthProperties oauthProperties,
      CredentialStore credentialStore,
      AuditService auditService,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.stateRepository = stateRepository;
    this.providerRegistry = providerRegistry;
    this.providersProperties = providersProperties;
    this.oauthProperties = oauthProperties;
    this.credentialStore = credentialStore;
    this.auditService = auditService;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  public record HandshakeStart(String authorizationUrl, String state, Instant expiresAt) {}

  public record CallbackResult(Integration integration, String redirectTo) {}

  /**
   * Persists a fresh state token and returns the provider's authorization URL.
   *
   * @param redirectAfter same-origin path to return the user to; null for the default
   * @throws ProviderNotConfiguredException if the provider has no client registration or adapter
   * @throws InvalidStateException if {@code redirectAfter} is not a relative path
   */
  public HandshakeStart beginHandshake(
      UUID tenantId, String userId, ProviderType provider, String redirectAfter) {
    var registration =
        providersProperties
            .find(provider)
            .filter(ProvidersProperties.Provider::isConfigured)
            .orElseThrow(() -> new ProviderNotConfiguredException(provider));
    if (!providerRegistry.isRegistered(provider)) {
      throw new ProviderNotConfiguredException(provider);
    }
    String target = normalizeRedirect(redirectAfter);

    Instant now = clock.instant();
    Instant expiresAt = now.plus(oauthProperties.stateTtl());
    String state = newStateToken();

    transactionTemplate.executeWithoutResult(
        status -> {
          if (oauthProperties.invalidatePreviousStates()) {
            int invalidated = stateRepository.consumeOpenStates(tenantId, provider, now);
            if (invalidated > 0) {
              log.debug("Invalidated {} open OAuth states for {}", invalidated, provider);
            }
          }
          stateRepository.save(
              new OAuthState(state, tenantId, userId, provider, target, now, expiresAt));
        });

    var uri =
        UriComponentsBuilder.fromUriString(registration.authorizationUri())
            .queryParam("client_id", registration.clientId())
            .queryParam("redirect_uri", redirectUri(provider))
            .queryParam("response_type", "code")
            .queryParam("state", state);
    if (!registration.scopes().isEmpty()) {
      uri.queryParam("scope", String.join(registration.scopeDelimiter(), registration.scopes()));
    }
    registration.extraAuthorizationParams().forEach(uri::queryParam);

    log.info("Started {} OAuth handshake for tenant {}", provider.getSlug(), tenantId);
    auditService.log(
        AuditEventBuilder.builder()
            .tenantId(tenantId)
            .actorId(userId)
            .eventType("integration.handshake_started")
            .resourceType("integration")
            .details(Map.of("provider", provider.getSlug(), "expires_at", expiresAt.toString()))
            .build());

    return new HandshakeStart(uri.encode().build().toUriString(), state, expiresAt);
  }

  /**
   * Completes the handshake for {@code provider}.
   *
   * @param providerError the {@code error} parameter sent when the user declined consent
   * @throws InvalidOAuthStateException if the state is unknown, used, expired or for another
   *     provider
   * @throws TokenExchangeException if consent was declined or the provider refused the code
   */
  public CallbackResult handleCallback(
      ProviderType provider, String stateToken, String code, String providerError) {
    OAuthState state = consumeState(provider, stateToken);
    UUID tenantId = state.getTenantId();

    if (providerError != null && !providerError.isBlank()) {
      throw connectFailed(state, providerError, null);
    }
    if (code == null || code.isBlank()) {
      throw connectFailed(state, "missing_code", null);
    }

    var client = providerRegistry.resolve(provider);
    Integration integration;
    try {
      var grant = client.exchangeCode(code, redirectUri(provider));
      integration = credentialStore.connect(tenantId, provider, grant);
    } catch (ProviderException e) {
      throw connectFailed(state, e.getMessage(), e);
    }

    var details = new LinkedHashMap<String, Object>();
    details.put("provider", provider.getSlug());
    details.put("external_account_id", integration.getExternalAccountId());
    details.put("scopes", integration.getScopes());
    auditService.log(
        AuditEventBuilder.builder()
            .tenantId(tenantId)
            .actorId(state.getUserId())
            .actorType("USER")
            .eventType("integration.connected")
            .resourceType("integration")
            .resourceId(integration.getId())
            .details(details)
            .build());

    return new CallbackResult(integration, state.getRedirectAfter());
  }

  String redirectUri(ProviderType provider) {
    return UriComponentsBuilder.fromUriString(oauthProperties.callbackBaseUrl())
        .path("/api/integrations/{provider}/callback")
        .buildAndExpand(provider.getSlug())
        .toUriString();
  }

  private OAuthState consumeState(ProviderType provider, String stateToken) {
    if (stateToken == null || stateToken.isBlank()) {
      throw rejected("missing", null);
    }
    Instant now = clock.instant();
    var state = stateRepository.findById(stateToken).orElseThrow(() -> rejected("unknown", null));
    if (state.isConsumed()) {
      throw rejected("already_used", state);
    }
    if (state.isExpiredAt(now)) {
      throw rejected("expired", state);
    }
    if (state.getProvider() != provider) {
      throw rejected("provider_mismatch", state);
    }
    Integer consumed =
        transactionTemplate.execute(status -> stateRepository.consume(stateToken, now));
    if (consumed == null || consumed == 0) {
      throw rejected("already_used", state);
    }
    return state;
  }

  private InvalidOAuthStateException rejected(String reason, OAuthState state) {
    if (state == null) {
      log.warn("Rejected OAuth callback: reason={}", reason);
    } else {
      log.warn(
          "Rejected OAuth callback: reason={}, tenant={}, provider={}",
          reason,
          state.getTenantId(),
          state.getProvider());
    }
    return new InvalidOAuthStateException(reason);
  }

  private TokenExchangeException connectFailed(
      OAuthState state, String providerError, Throwable cause) {
    log.warn(
        "OAuth connect failed for tenant {} ({}): {}",
        state.getTenantId(),
        state.getProvider().getSlug(),
        providerError);
    auditService.log(
        AuditEventBuilder.builder()
            .tenantId(state.getTenantId())
            .actorId(state.getUserId())
            .actorType("USER")
            .eventType("integration.connect_failed")
            .resourceType("integration")
            .details(
                Map.of("provider", state.getProvider().getSlug(), "error", providerError))
            .build());
    return new TokenExchangeException(state.getProvider(), providerError, cause);
  }

  private String normalizeRedirect(String redirectAfter) {
    if (redirectAfter == null || redirectAfter.isBlank()) {
      return oauthProperties.defaultRedirect();
    }
    if (!redirectAfter.startsWith("/") || redirectAfter.startsWith("//")) {
      throw new InvalidStateException(
          "Invalid redirect", "redirectAfter must be a relative path starting with '/'");
    }
    return redirectAfter;
  }

  private String newStateToken() {
    byte[] bytes = new byte[STATE_BYTES];
    secureRandom.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }
}
