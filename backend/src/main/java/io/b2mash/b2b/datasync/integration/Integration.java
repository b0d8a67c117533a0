package io.b2mash.b2b.datasync.integration;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A tenant's connection to one external account. Tokens are stored as ciphertext produced by
 * {@link io.b2mash.b2b.datasync.integration.credential.TokenCipher}; this entity never sees
 * plaintext.
 *
 * <p>{@code tokenVersion} changes whenever the stored token pair changes and guards conditional
 * token rotation. {@code version} is the JPA optimistic lock for entity-level writes.
 */
@Entity
@Table(
    name = "integrations",
    uniqueConstraints =
        @UniqueConstraint(columnNames = {"tenant_id", "provider", "external_account_id"}))
public class Integration {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private UUID tenantId;

  @Enumerated(EnumType.STRING)
  @Column(name = "provider", nullable = false, length = 20, updatable = false)
  private ProviderType provider;

  @Column(name = "external_account_id", nullable = false, updatable = false)
  private String externalAccountId;

  @Column(name = "external_account_name")
  private String externalAccountName;

  @Column(name = "access_token", columnDefinition = "TEXT")
  private String accessToken;

  @Column(name = "refresh_token", columnDefinition = "TEXT")
  private String refreshToken;

  @Column(name = "token_type", length = 30)
  private String tokenType;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "scopes", columnDefinition = "jsonb", nullable = false)
  private List<String> scopes = new ArrayList<>();

  @Column(name = "expires_at")
  private Instant expiresAt;

  @Column(name = "token_version", nullable = false)
  private long tokenVersion;

  @Column(name = "last_synced_at")
  private Instant lastSyncedAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "sync_status", nullable = false, length = 20)
  private SyncStatus syncStatus;

  @Enumerated(EnumType.STRING)
  @Column(name = "error_category", length = 30)
  private ErrorCategory errorCategory;

  @Column(name = "last_error", columnDefinition = "TEXT")
  private String lastError;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "connected_at")
  private Instant connectedAt;

  @Column(name = "disconnected_at")
  private Instant disconnectedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected Integration() {}

  public Integration(UUID tenantId, ProviderType provider, String externalAccountId) {
    this.tenantId = tenantId;
    this.provider = provider;
    this.externalAccountId = externalAccountId;
    this.syncStatus = SyncStatus.IDLE;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  /**
   * Stores a freshly granted token pair and (re)activates the connection. Clears any previous
   * error, including {@link ErrorCategory#RECONNECT_REQUIRED}.
   */
  public void applyConnection(
      String externalAccountName,
      String encryptedAccessToken,
      String encryptedRefreshToken,
      String tokenType,
      List<String> scopes,
      Instant expiresAt,
      Instant connectedAt) {
    this.externalAccountName = externalAccountName;
    this.accessToken = encryptedAccessToken;
    this.refreshToken = encryptedRefreshToken;
    this.tokenType = tokenType;
    this.scopes = scopes != null ? new ArrayList<>(scopes) : new ArrayList<>();
    this.expiresAt = expiresAt;
    this.tokenVersion++;
    this.active = true;
    this.syncStatus = SyncStatus.IDLE;
    this.errorCategory = null;
    this.lastError = null;
    this.connectedAt = connectedAt;
    this.disconnectedAt = null;
  }

  /** True when reconnection is the only way forward. */
  public boolean requiresReconnect() {
    return errorCategory == ErrorCategory.RECONNECT_REQUIRED;
  }

  public UUID getId() {
    return id;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public ProviderType getProvider() {
    return provider;
  }

  public String getExternalAccountId() {
    return externalAccountId;
  }

  public String getExternalAccountName() {
    return externalAccountName;
  }

  public String getAccessToken() {
    return accessToken;
  }

  public String getRefreshToken() {
    return refreshToken;
  }

  public String getTokenType() {
    return tokenType;
  }

  public List<String> getScopes() {
    return scopes;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public long getTokenVersion() {
    return tokenVersion;
  }

  public Instant getLastSyncedAt() {
    return lastSyncedAt;
  }

  public SyncStatus getSyncStatus() {
    return syncStatus;
  }

  public ErrorCategory getErrorCategory() {
    return errorCategory;
  }

  public String getLastError() {
    return lastError;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getConnectedAt() {
    return connectedAt;
  }

  public Instant getDisconnectedAt() {
    return disconnectedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public long getVersion() {
    return version;
  }
}
