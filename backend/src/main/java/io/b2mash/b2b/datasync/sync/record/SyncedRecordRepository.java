package io.b2mash.b2b.datasync.sync.record;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SyncedRecordRepository extends JpaRepository<SyncedRecord, UUID> {

  Page<SyncedRecord> findByTenantIdAndIntegrationId(
      UUID tenantId, UUID integrationId, Pageable pageable);

  Page<SyncedRecord> findByTenantIdAndIntegrationIdAndRecordType(
      UUID tenantId, UUID integrationId, String recordType, Pageable pageable);

  Optional<SyncedRecord> findByIntegrationIdAndRecordTypeAndExternalId(
      UUID integrationId, String recordType, String externalId);

  long countByIntegrationId(UUID integrationId);
}
