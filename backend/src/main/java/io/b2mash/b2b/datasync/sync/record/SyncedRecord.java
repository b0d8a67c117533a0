package io.b2mash.b2b.datasync.sync.record;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** Latest copy of a provider record. Written only by {@link DatabaseRecordSink}'s upsert. */
@Entity
@Immutable
@Table(name = "synced_records")
public class SyncedRecord {

  @Id private UUID id;

  @Column(name = "tenant_id", nullable = false)
  private UUID tenantId;

  @Column(name = "integration_id", nullable = false)
  private UUID integrationId;

  @Column(name = "record_type", nullable = false, length = 100)
  private String recordType;

  @Column(name = "external_id", nullable = false, length = 255)
  private String externalId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "payload", columnDefinition = "jsonb", nullable = false)
  private Map<String, Object> payload;

  @Column(name = "last_job_id", nullable = false)
  private UUID lastJobId;

  @Column(name = "first_synced_at", nullable = false)
  private Instant firstSyncedAt;

  @Column(name = "last_synced_at", nullable = false)
  private Instant lastSyncedAt;

  protected SyncedRecord() {}

  public UUID getId() {
    return id;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public UUID getIntegrationId() {
    return integrationId;
  }

  public String getRecordType() {
    return recordType;
  }

  public String getExternalId() {
    return externalId;
  }

  public Map<String, Object> getPayload() {
    return payload;
  }

  public UUID getLastJobId() {
    return lastJobId;
  }

  public Instant getFirstSyncedAt() {
    return firstSyncedAt;
  }

  public Instant getLastSyncedAt() {
    return lastSyncedAt;
  }
}
