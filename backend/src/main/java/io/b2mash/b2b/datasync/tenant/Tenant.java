package io.b2mash.b2b.datasync.tenant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A customer organization. Soft-deactivated on churn, never deleted. */
@Entity
@Table(name = "tenants")
public class Tenant {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false)
  private String name;

  @Column(name = "subdomain", nullable = false, unique = true, length = 63)
  private String subdomain;

  @Column(name = "owner_user_id", nullable = false)
  private String ownerUserId;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Enumerated(EnumType.STRING)
  @Column(name = "tier", nullable = false, length = 20)
  private SubscriptionTier tier;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Tenant() {}

  public Tenant(String name, String subdomain, String ownerUserId, SubscriptionTier tier) {
    this.name = name;
    this.subdomain = subdomain;
    this.ownerUserId = ownerUserId;
    this.tier = tier != null ? tier : SubscriptionTier.STARTER;
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getSubdomain() {
    return subdomain;
  }

  public String getOwnerUserId() {
    return ownerUserId;
  }

  public boolean isActive() {
    return active;
  }

  public SubscriptionTier getTier() {
    return tier;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }
}
