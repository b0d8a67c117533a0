package io.b2mash.b2b.datasync.integration;

import io.b2mash.b2b.datasync.ratelimit.RateLimitStatus;
import io.b2mash.b2b.datasync.security.Roles;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/integrations")
public class IntegrationController {

  private final IntegrationService integrationService;

  public IntegrationController(IntegrationService integrationService) {
    this.integrationService = integrationService;
  }

  @GetMapping
  @PreAuthorize(Roles.VIEW_INTEGRATIONS)
  public ResponseEntity<List<IntegrationResponse>> listIntegrations() {
    return ResponseEntity.ok(
        integrationService.listIntegrations().stream().map(IntegrationResponse::from).toList());
  }

  @GetMapping("/{id}")
  @PreAuthorize(Roles.VIEW_INTEGRATIONS)
  public ResponseEntity<IntegrationResponse> getIntegration(@PathVariable UUID id) {
    return ResponseEntity.ok(IntegrationResponse.from(integrationService.getIntegration(id)));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize(Roles.MANAGE_INTEGRATIONS)
  public ResponseEntity<Void> disconnect(@PathVariable UUID id) {
    integrationService.disconnect(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/test")
  @PreAuthorize(Roles.MANAGE_INTEGRATIONS)
  public ResponseEntity<ConnectionTestResponse> testConnection(@PathVariable UUID id) {
    return ResponseEntity.ok(
        ConnectionTestResponse.from(integrationService.testConnection(id)));
  }

  @GetMapping("/{id}/rate-limit")
  @PreAuthorize(Roles.VIEW_INTEGRATIONS)
  public ResponseEntity<RateLimitResponse> rateLimit(@PathVariable UUID id) {
    return ResponseEntity.ok(RateLimitResponse.from(integrationService.rateLimitStatus(id)));
  }

  /** Tokens are never part of the response. */
  public record IntegrationResponse(
      UUID id,
      String provider,
      String externalAccountId,
      String externalAccountName,
      List<String> scopes,
      boolean active,
      String syncStatus,
      String errorCategory,
      String lastError,
      Instant tokenExpiresAt,
      Instant lastSyncedAt,
      Instant connectedAt,
      Instant disconnectedAt,
      Instant createdAt) {

    public static IntegrationResponse from(Integration integration) {
      return new IntegrationResponse(
          integration.getId(),
          integration.getProvider().getSlug(),
          integration.getExternalAccountId(),
          integration.getExternalAccountName(),
          integration.getScopes(),
          integration.isActive(),
          integration.getSyncStatus().name(),
          integration.getErrorCategory() != null ? integration.getErrorCategory().name() : null,
          integration.getLastError(),
          integration.getExpiresAt(),
          integration.getLastSyncedAt(),
          integration.getConnectedAt(),
          integration.getDisconnectedAt(),
          integration.getCreatedAt());
    }
  }

  public record RateLimitResponse(
      Instant windowStart, Instant windowEnd, int requestsMade, int requestsLimit, int remaining) {

    static RateLimitResponse from(RateLimitStatus status) {
      return new RateLimitResponse(
          status.windowStart(),
          status.windowEnd(),
          status.requestsMade(),
          status.requestsLimit(),
          status.remaining());
    }
  }

  public record ConnectionTestResponse(
      boolean success,
      String provider,
      String errorCategory,
      String errorMessage,
      Long retryAfterSeconds) {

    static ConnectionTestResponse from(ConnectionTestResult result) {
      return new ConnectionTestResponse(
          result.success(),
          result.provider().getSlug(),
          result.errorCategory() != null ? result.errorCategory().name() : null,
          result.errorMessage(),
          result.retryAfter() != null ? result.retryAfter().toSeconds() : null);
    }
  }
}
