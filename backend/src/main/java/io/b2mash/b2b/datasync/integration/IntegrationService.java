package io.b2mash.b2b.datasync.integration;

import io.b2mash.b2b.datasync.audit.AuditEventBuilder;
import io.b2mash.b2b.datasync.audit.AuditService;
import io.b2mash.b2b.datasync.exception.InvalidStateException;
import io.b2mash.b2b.datasync.exception.ResourceNotFoundException;
import io.b2mash.b2b.datasync.integration.credential.CredentialStore;
import io.b2mash.b2b.datasync.integration.credential.TokenPair;
import io.b2mash.b2b.datasync.integration.provider.FetchRequest;
import io.b2mash.b2b.datasync.integration.provider.ProviderException;
import io.b2mash.b2b.datasync.integration.provider.ProviderRegistry;
import io.b2mash.b2b.datasync.integration.provider.ProviderTransientException;
import io.b2mash.b2b.datasync.integration.provider.ProviderUnauthorizedException;
import io.b2mash.b2b.datasync.integration.provider.ProviderUnavailableException;
import io.b2mash.b2b.datasync.integration.token.RefreshFailedException;
import io.b2mash.b2b.datasync.integration.token.TokenRefresher;
import io.b2mash.b2b.datasync.multitenancy.RequestScopes;
import io.b2mash.b2b.datasync.ratelimit.RateGovernor;
import io.b2mash.b2b.datasync.ratelimit.RateLimitStatus;
import io.b2mash.b2b.datasync.sync.SyncService;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class IntegrationService {

  private static final Logger log = LoggerFactory.getLogger(IntegrationService.class);

  private final IntegrationRepository integrationRepository;
  private final CredentialStore credentialStore;
  private final ProviderRegistry providerRegistry;
  private final SyncService syncService;
  private final RateGovernor rateGovernor;
  private final TokenRefresher tokenRefresher;
  private final AuditService auditService;

  public IntegrationService(
      IntegrationRepository integrationRepository,
      CredentialStore credentialStore,
      ProviderRegistry providerRegistry,
      SyncService syncService,
      RateGovernor rateGovernor,
      TokenRefresher tokenRefresher,
      AuditService auditService) {
    this.integrationRepository = integrationRepository;
    this.credentialStore = credentialStore;
    this.providerRegistry = providerRegistry;
    this.syncService = syncService;
    this.rateGovernor = rateGovernor;
    this.tokenRefresher = tokenRefresher;
    this.auditService = auditService;
  }

  public List<Integration> listIntegrations() {
    return integrationRepository.findByTenantIdOrderByCreatedAtAsc(
        RequestScopes.requireTenantId());
  }

  public Integration getIntegration(UUID integrationId) {
    return integrationRepository
        .findByIdAndTenantId(integrationId, RequestScopes.requireTenantId())
        .orElseThrow(() -> new ResourceNotFoundException("Integration", integrationId));
  }

  /**
   * Disconnects an integration: cancels its active sync jobs, wipes the stored tokens and revokes
   * them at the provider when it supports revocation. Job history and audit events are kept.
   * Disconnecting an inactive integration does nothing.
   */
  public void disconnect(UUID integrationId) {
    var integration = getIntegration(integrationId);
    if (!integration.isActive()) {
      log.debug("Integration {} is already disconnected", integrationId);
      return;
    }

    int cancelledJobs = syncService.cancelActiveJobs(integrationId);
    TokenPair tokens = readTokensForRevocation(integration);
    if (!credentialStore.disconnect(integrationId)) {
      log.info("Integration {} was disconnected concurrently", integrationId);
      return;
    }
    boolean revoked = revoke(integration, tokens);

    log.info(
        "Disconnected integration {} ({}); revoked={}, cancelled jobs={}",
        integrationId,
        integration.getProvider(),
        revoked,
        cancelledJobs);
    var details = new LinkedHashMap<String, Object>();
    details.put("provider", integration.getProvider().getSlug());
    details.put("external_account_id", integration.getExternalAccountId());
    details.put("tokens_revoked", revoked);
    details.put("cancelled_jobs", cancelledJobs);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("integration.disconnected")
            .resourceType("integration")
            .resourceId(integrationId)
            .details(details)
            .build());
  }

  /**
   * Makes one rate-limited request for a single record with a fresh access token and reports
   * whether the provider accepted it. Sync jobs and the integration's sync status are left alone.
   */
  public ConnectionTestResult testConnection(UUID integrationId) {
    var integration = getIntegration(integrationId);
    if (!integration.isActive()) {
      throw new InvalidStateException(
          "Integration disconnected",
          "Integration " + integrationId + " is disconnected; connect it again to test it");
    }
    var client = providerRegistry.resolve(integration.getProvider());

    ConnectionTestResult result;
    try {
      var fresh = tokenRefresher.ensureFreshToken(integration);
      if (!rateGovernor.tryAcquire(fresh)) {
        result =
            ConnectionTestResult.failed(
                fresh.getProvider(),
                ErrorCategory.TRANSIENT,
                "Rate limit for this integration is used up in the current window",
                rateGovernor.waitTime(fresh));
      } else {
        var tokens = credentialStore.readTokens(fresh);
        client.fetchPage(tokens.accessToken(), new FetchRequest(null, null, 1, null), null);
        result = ConnectionTestResult.succeeded(fresh.getProvider());
      }
    } catch (RefreshFailedException e) {
      result =
          ConnectionTestResult.failed(
              integration.getProvider(),
              ErrorCategory.RECONNECT_REQUIRED,
              e.getBody().getDetail(),
              null);
    } catch (ProviderException e) {
      result =
          ConnectionTestResult.failed(
              integration.getProvider(), categoryOf(e), e.getMessage(), retryAfterOf(e));
    }

    log.info(
        "Connection test for integration {} ({}): success={}, category={}",
        integrationId,
        integration.getProvider(),
        result.success(),
        result.errorCategory());
    var details = new LinkedHashMap<String, Object>();
    details.put("provider", integration.getProvider().getSlug());
    details.put("success", result.success());
    if (result.errorCategory() != null) {
      details.put("error_category", result.errorCategory().name());
      details.put("error_message", result.errorMessage());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("integration.connection_tested")
            .resourceType("integration")
            .resourceId(integrationId)
            .details(details)
            .build());
    return result;
  }

  public RateLimitStatus rateLimitStatus(UUID integrationId) {
    return rateGovernor.status(getIntegration(integrationId));
  }

  private static ErrorCategory categoryOf(ProviderException e) {
    if (e instanceof ProviderUnauthorizedException) {
      return ErrorCategory.RECONNECT_REQUIRED;
    }
    if (e instanceof ProviderTransientException || e instanceof ProviderUnavailableException) {
      return ErrorCategory.TRANSIENT;
    }
    return ErrorCategory.PERMANENT;
  }

  private static Duration retryAfterOf(ProviderException e) {
    return e instanceof ProviderUnavailableException pue ? pue.getRetryAfter() : null;
  }

  private TokenPair readTokensForRevocation(Integration integration) {
    try {
      return credentialStore.readTokens(integration);
    } catch (IllegalStateException e) {
      log.warn(
          "Could not decrypt tokens of integration {}; skipping revocation: {}",
          integration.getId(),
          e.getMessage());
      return null;
    }
  }

  private boolean revoke(Integration integration, TokenPair tokens) {
    if (tokens == null || !providerRegistry.isRegistered(integration.getProvider())) {
      return false;
    }
    var client = providerRegistry.resolve(integration.getProvider());
    if (!client.supportsRevocation()) {
      return false;
    }
    String token = tokens.hasRefreshToken() ? tokens.refreshToken() : tokens.accessToken();
    if (token == null) {
      return false;
    }
    try {
      client.revoke(token);
      return true;
    } catch (ProviderException e) {
      log.warn(
          "Token revocation failed for integration {} ({}): {}",
          integration.getId(),
          integration.getProvider(),
          e.getMessage());
      return false;
    }
  }
}
