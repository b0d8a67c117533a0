package io.b2mash.b2b.datasync.sync.record;

import io.b2mash.b2b.datasync.exception.ResourceNotFoundException;
import io.b2mash.b2b.datasync.integration.IntegrationRepository;
import io.b2mash.b2b.datasync.multitenancy.RequestScopes;
import io.b2mash.b2b.datasync.security.Roles;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SyncedRecordController {

  private final SyncedRecordRepository syncedRecordRepository;
  private final IntegrationRepository integrationRepository;

  public SyncedRecordController(
      SyncedRecordRepository syncedRecordRepository, IntegrationRepository integrationRepository) {
    this.syncedRecordRepository = syncedRecordRepository;
    this.integrationRepository = integrationRepository;
  }

  @GetMapping("/api/integrations/{integrationId}/records")
  @PreAuthorize(Roles.VIEW_INTEGRATIONS)
  public ResponseEntity<Page<SyncedRecordResponse>> listRecords(
      @PathVariable UUID integrationId,
      @RequestParam(required = false) String recordType,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    UUID tenantId = RequestScopes.requireTenantId();
    if (integrationRepository.findByIdAndTenantId(integrationId, tenantId).isEmpty()) {
      throw new ResourceNotFoundException("Integration", integrationId);
    }
    var pageable =
        PageRequest.of(page, Math.min(size, 200), Sort.by(Sort.Direction.DESC, "lastSyncedAt"));
    var records =
        recordType != null
            ? syncedRecordRepository.findByTenantIdAndIntegrationIdAndRecordType(
                tenantId, integrationId, recordType, pageable)
            : syncedRecordRepository.findByTenantIdAndIntegrationId(
                tenantId, integrationId, pageable);
    return ResponseEntity.ok(records.map(SyncedRecordResponse::from));
  }

  public record SyncedRecordResponse(
      UUID id,
      String recordType,
      String externalId,
      Map<String, Object> payload,
      UUID lastJobId,
      Instant firstSyncedAt,
      Instant lastSyncedAt) {

    static SyncedRecordResponse from(SyncedRecord record) {
      return new SyncedRecordResponse(
          record.getId(),
          record.getRecordType(),
          record.getExternalId(),
          record.getPayload(),
          record.getLastJobId(),
          record.getFirstSyncedAt(),
          record.getLastSyncedAt());
    }
  }
}
