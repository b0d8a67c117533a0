package io.b2mash.b2b.datasync.integration.oauth;

import io.b2mash.b2b.datasync.integration.ProviderType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Single-use CSRF token binding an OAuth callback to the tenant and user who started the
 * handshake. Consumption happens through {@link OAuthStateRepository#consume}, never by mutating
 * the entity.
 */
@Entity
@Table(name = "oauth_states")
public class OAuthState {

  @Id
  @Column(name = "state", nullable = false, length = 64)
  private String state;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private UUID tenantId;

  @Column(name = "user_id", nullable = false, updatable = false)
  private String userId;

  @Enumerated(EnumType.STRING)
  @Column(name = "provider", nullable = false, length = 20, updatable = false)
  private ProviderType provider;

  @Column(name = "redirect_after", nullable = false, length = 500)
  private String redirectAfter;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "expires_at", nullable = false, updatable = false)
  private Instant expiresAt;

  @Column(name = "consumed", nullable = false)
  private boolean consumed;

  @Column(name = "consumed_at")
  private Instant consumedAt;

  protected OAuthState() {}

  public OAuthState(
      String state,
      UUID tenantId,
      String userId,
      ProviderType provider,
      String redirectAfter,
      Instant createdAt,
      Instant expiresAt) {
    this.state = state;
    this.tenantId = tenantId;
    this.userId = userId;
    this.provider = provider;
    this.redirectAfter = redirectAfter;
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
  }

  public boolean isExpiredAt(Instant now) {
    return !expiresAt.isAfter(now);
  }

  public String getState() {
    return state;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public String getUserId() {
    return userId;
  }

  public ProviderType getProvider() {
    return provider;
  }

  public String getRedirectAfter() {
    return redirectAfter;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public boolean isConsumed() {
    return consumed;
  }

  public Instant getConsumedAt() {
    return consumedAt;
  }
}
