package io.b2mash.b2b.datasync.sync;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One execution of a sync for an integration.
 *
 * <p>The entity is only inserted through JPA. Every later change is a conditional update in
 * {@link SyncJobRepository} keyed on the current status, which is what keeps transitions
 * monotonic when the API, a worker and the reaper act on the same job.
 */
@Entity
@DynamicUpdate
@Table(name = "sync_jobs")
public class SyncJob {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private UUID tenantId;

  @Column(name = "integration_id", nullable = false, updatable = false)
  private UUID integrationId;

  @Enumerated(EnumType.STRING)
  @Column(name = "kind", nullable = false, length = 20, updatable = false)
  private SyncJobKind kind;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private SyncJobStatus status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "started_at")
  private Instant startedAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "records_fetched", nullable = false)
  private int recordsFetched;

  @Column(name = "records_processed", nullable = false)
  private int recordsProcessed;

  @Column(name = "records_failed", nullable = false)
  private int recordsFailed;

  @Column(name = "error_message", columnDefinition = "TEXT")
  private String errorMessage;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "error_details", columnDefinition = "jsonb")
  private Map<String, Object> errorDetails;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "params", columnDefinition = "jsonb", nullable = false, updatable = false)
  private Map<String, Object> params = new HashMap<>();

  @Column(name = "cancel_requested", nullable = false)
  private boolean cancelRequested;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "triggered_by")
  private String triggeredBy;

  protected SyncJob() {}

  public SyncJob(
      UUID tenantId,
      UUID integrationId,
      SyncJobKind kind,
      SyncParams params,
      String triggeredBy,
      Instant createdAt) {
    this.tenantId = tenantId;
    this.integrationId = integrationId;
    this.kind = kind;
    this.params = new HashMap<>(params.toMap());
    this.triggeredBy = triggeredBy;
    this.status = SyncJobStatus.PENDING;
    this.createdAt = createdAt;
  }

  public SyncParams syncParams() {
    return SyncParams.fromMap(params);
  }

  public UUID getId() {
    return id;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public UUID getIntegrationId() {
    return integrationId;
  }

  public SyncJobKind getKind() {
    return kind;
  }

  public SyncJobStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public int getRecordsFetched() {
    return recordsFetched;
  }

  public int getRecordsProcessed() {
    return recordsProcessed;
  }

  public int getRecordsFailed() {
    return recordsFailed;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public Map<String, Object> getErrorDetails() {
    return errorDetails;
  }

  public Map<String, Object> getParams() {
    return params;
  }

  public boolean isCancelRequested() {
    return cancelRequested;
  }

  public int getAttempts() {
    return attempts;
  }

  public String getTriggeredBy() {
    return triggeredBy;
  }
}
