package io.b2mash.b2b.datasync.ratelimit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/**
 * Request budget of one integration for one fixed window. Rows are created and incremented only
 * through native statements in {@link RateLimitWindowRepository}; the entity is read-only.
 */
@Entity
@Table(
    name = "rate_limit_windows",
    uniqueConstraints = @UniqueConstraint(columnNames = {"integration_id", "window_start"}))
public class RateLimitWindow {

  @Id private UUID id;

  @Column(name = "integration_id", nullable = false)
  private UUID integrationId;

  @Column(name = "window_start", nullable = false)
  private Instant windowStart;

  @Column(name = "window_end", nullable = false)
  private Instant windowEnd;

  @Column(name = "requests_made", nullable = false)
  private int requestsMade;

  @Column(name = "requests_limit", nullable = false)
  private int requestsLimit;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected RateLimitWindow() {}

  public UUID getId() {
    return id;
  }

  public UUID getIntegrationId() {
    return integrationId;
  }

  public Instant getWindowStart() {
    return windowStart;
  }

  public Instant getWindowEnd() {
    return windowEnd;
  }

  public int getRequestsMade() {
    return requestsMade;
  }

  public int getRequestsLimit() {
    return requestsLimit;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
