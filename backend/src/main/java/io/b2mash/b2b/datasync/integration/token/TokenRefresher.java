package io.b2mash.b2b.datasync.integration.token;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.b2b.datasync.audit.AuditEventBuilder;
import io.b2mash.b2b.datasync.audit.AuditService;
import io.b2mash.b2b.datasync.config.SyncProperties;
import io.b2mash.b2b.datasync.exception.ResourceNotFoundException;
import io.b2mash.b2b.datasync.integration.ErrorCategory;
import io.b2mash.b2b.datasync.integration.Integration;
import io.b2mash.b2b.datasync.integration.IntegrationRepository;
import io.b2mash.b2b.datasync.integration.credential.CredentialStore;
import io.b2mash.b2b.datasync.integration.provider.ProviderPermanentException;
import io.b2mash.b2b.datasync.integration.provider.ProviderRegistry;
import io.b2mash.b2b.datasync.integration.provider.ProviderUnauthorizedException;
import io.b2mash.b2b.datasync.integration.provider.TokenRefreshResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Keeps access tokens valid.
 *
 * <p>Refreshes of one integration are serialized by an in-process lock; across instances the
 * token-version guard in {@link CredentialStore#rotateTokens} decides the winner. A caller that
 * loses re-reads the integration and adopts the token the winner stored, since many providers
 * invalidate a refresh token once it has been used.
 */
@Service
public class TokenRefresher {

  private static final Logger log = LoggerFactory.getLogger(TokenRefresher.class);

  static final int MAX_REREADS = 3;

  private final IntegrationRepository integrationRepository;
  private final CredentialStore credentialStore;
  private final ProviderRegistry providerRegistry;
  private final AuditService auditService;
  private final SyncProperties syncProperties;
  private final Clock clock;
  private final Cache<UUID, ReentrantLock> locks = Caffeine.newBuilder().weakValues().build();

  public TokenRefresher(
      IntegrationRepository integrationRepository,
      CredentialStore credentialStore,
      ProviderRegistry providerRegistry,
      AuditService auditService,
      SyncProperties syncProperties,
      Clock clock) {
    this.integrationRepository = integrationRepository;
    this.credentialStore = credentialStore;
    this.providerRegistry = providerRegistry;
    this.auditService = auditService;
    this.syncProperties = syncProperties;
    this.clock = clock;
  }

  /**
   * Returns {@code integration} unchanged unless its token expires within the refresh skew, in
   * which case the refreshed integration is returned.
   *
   * @throws RefreshFailedException if no refresh token is stored or the provider rejects it
   */
  public Integration ensureFreshToken(Integration integration) {
    return refreshIfExpiringWithin(integration, syncProperties.refreshSkew());
  }

  public Integration refreshIfExpiringWithin(Integration integration, Duration window) {
    if (!expiresWithin(integration, window)) {
      return integration;
    }
    return refresh(integration.getId(), window, null);
  }

  /**
   * Refreshes regardless of the stored expiry, after the provider rejected the current access
   * token. Returns early if another caller already replaced the rejected token.
   */
  public Integration forceRefresh(Integration integration) {
    return refresh(integration.getId(), null, integration.getTokenVersion());
  }

  private Integration refresh(UUID integrationId, Duration window, Long rejectedTokenVersion) {
    ReentrantLock lock = locks.get(integrationId, id -> new ReentrantLock());
    lock.lock();
    try {
      for (int read = 0; read < MAX_REREADS; read++) {
        Integration current = load(integrationId);
        if (!current.isActive()) {
          throw new RefreshFailedException(integrationId, "integration is disconnected", null);
        }
        if (rejectedTokenVersion != null
            ? current.getTokenVersion() != rejectedTokenVersion
            : !expiresWithin(current, window)) {
          log.debug("Integration {} already holds a fresh token", integrationId);
          return current;
        }

        var tokens = credentialStore.readTokens(current);
        if (!tokens.hasRefreshToken()) {
          throw reconnectRequired(current, "no refresh token stored", null);
        }

        var client = providerRegistry.resolve(current.getProvider());
        TokenRefreshResult result;
        try {
          result = client.refreshToken(tokens.refreshToken());
        } catch (ProviderUnauthorizedException | ProviderPermanentException e) {
          if (load(integrationId).getTokenVersion() != current.getTokenVersion()) {
            // Rejected because a concurrent refresher already rotated the refresh token.
            continue;
          }
          throw reconnectRequired(current, "provider rejected the refresh token", e);
        }

        var rotated =
            credentialStore.rotateTokens(integrationId, current.getTokenVersion(), result);
        if (rotated.isPresent()) {
          var refreshed = rotated.get();
          log.info(
              "Refreshed access token for integration {}; expires at {}",
              integrationId,
              refreshed.getExpiresAt());
          var details = new LinkedHashMap<String, Object>();
          details.put("provider", refreshed.getProvider().getSlug());
          details.put("refresh_token_rotated", result.refreshToken() != null);
          if (refreshed.getExpiresAt() != null) {
            details.put("expires_at", refreshed.getExpiresAt().toString());
          }
          auditService.log(
              AuditEventBuilder.builder()
                  .tenantId(refreshed.getTenantId())
                  .eventType("integration.token_refreshed")
                  .resourceType("integration")
                  .resourceId(integrationId)
                  .details(details)
                  .build());
          return refreshed;
        }
        log.debug("Token rotation for integration {} was superseded; re-reading", integrationId);
      }
      throw new RefreshFailedException(
          integrationId, "token rotation did not settle after " + MAX_REREADS + " reads", null);
    } finally {
      lock.unlock();
    }
  }

  private RefreshFailedException reconnectRequired(
      Integration integration, String reason, Throwable cause) {
    log.warn("Token refresh failed for integration {}: {}", integration.getId(), reason);
    integrationRepository.markFailed(
        integration.getId(),
        ErrorCategory.RECONNECT_REQUIRED,
        "Reconnection required: " + reason,
        clock.instant());
    auditService.log(
        AuditEventBuilder.builder()
            .tenantId(integration.getTenantId())
            .eventType("integration.token_refresh_failed")
            .resourceType("integration")
            .resourceId(integration.getId())
            .details(Map.of("provider", integration.getProvider().getSlug(), "reason", reason))
            .build());
    return new RefreshFailedException(integration.getId(), reason, cause);
  }

  private boolean expiresWithin(Integration integration, Duration window) {
    Instant expiresAt = integration.getExpiresAt();
    return expiresAt != null && !expiresAt.isAfter(clock.instant().plus(window));
  }

  private Integration load(UUID integrationId) {
    return integrationRepository
        .findById(integrationId)
        .orElseThrow(() -> new ResourceNotFoundException("Integration", integrationId));
  }
}
