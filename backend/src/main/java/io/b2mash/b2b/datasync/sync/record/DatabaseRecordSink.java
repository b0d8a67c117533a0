package io.b2mash.b2b.datasync.sync.record;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.datasync.integration.provider.ProviderRecord;
import io.b2mash.b2b.datasync.sync.SyncJob;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Upserts records into {@code synced_records}, keyed by integration, record type and external id.
 * A page is written in one transaction.
 */
@Component
public class DatabaseRecordSink implements SyncRecordSink {

  private static final Logger log = LoggerFactory.getLogger(DatabaseRecordSink.class);

  static final int MAX_RECORD_TYPE_LENGTH = 100;
  static final int MAX_EXTERNAL_ID_LENGTH = 255;

  private final JdbcClient jdbc;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public DatabaseRecordSink(JdbcClient jdbc, ObjectMapper objectMapper, Clock clock) {
    this.jdbc = jdbc;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  @Transactional
  public PageWriteResult write(SyncJob job, List<ProviderRecord> records) {
    var now = Timestamp.from(clock.instant());
    int processed = 0;
    int failed = 0;
    for (var record : records) {
      if (!isStorable(record)) {
        log.debug("Skipping record without a usable type or external id in job {}", job.getId());
        failed++;
        continue;
      }
      String payload;
      try {
        payload =
            objectMapper.writeValueAsString(
                record.payload() != null ? record.payload() : Map.of());
      } catch (JsonProcessingException e) {
        log.warn(
            "Skipping {} record {} in job {}: payload is not serializable",
            record.recordType(),
            record.externalId(),
            job.getId());
        failed++;
        continue;
      }
      jdbc.sql(
              """
              INSERT INTO synced_records
                  (id, tenant_id, integration_id, record_type, external_id, payload,
                   last_job_id, first_synced_at, last_synced_at)
              VALUES (gen_random_uuid(), ?, ?, ?, ?, CAST(? AS jsonb), ?, ?, ?)
              ON CONFLICT (integration_id, record_type, external_id)
              DO UPDATE SET payload = EXCLUDED.payload,
                            last_job_id = EXCLUDED.last_job_id,
                            last_synced_at = EXCLUDED.last_synced_at
              """)
          .params(
              job.getTenantId(),
              job.getIntegrationId(),
              record.recordType(),
              record.externalId(),
              payload,
              job.getId(),
              now,
              now)
          .update();
      processed++;
    }
    return new PageWriteResult(processed, failed);
  }

  private static boolean isStorable(ProviderRecord record) {
    return record != null
        && record.recordType() != null
        && !record.recordType().isBlank()
        && record.recordType().length() <= MAX_RECORD_TYPE_LENGTH
        && record.externalId() != null
        && !record.externalId().isBlank()
        && record.externalId().length() <= MAX_EXTERNAL_ID_LENGTH;
  }
}
