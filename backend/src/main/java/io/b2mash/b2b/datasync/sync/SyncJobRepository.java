package io.b2mash.b2b.datasync.sync;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/**
 * Every status transition is guarded by the status it starts from and returns the number of rows
 * changed. A zero means another actor moved the job first.
 */
public interface SyncJobRepository extends JpaRepository<SyncJob, UUID> {

  Optional<SyncJob> findByIdAndTenantId(UUID id, UUID tenantId);

  Optional<SyncJob> findByIdAndIntegrationIdAndTenantId(
      UUID id, UUID integrationId, UUID tenantId);

  Page<SyncJob> findByIntegrationIdAndTenantId(
      UUID integrationId, UUID tenantId, Pageable pageable);

  boolean existsByIntegrationIdAndStatusIn(UUID integrationId, Collection<SyncJobStatus> statuses);

  List<SyncJob> findByIntegrationIdAndStatusIn(
      UUID integrationId, Collection<SyncJobStatus> statuses);

  @Query(
      """
      SELECT j FROM SyncJob j
      WHERE j.status = io.b2mash.b2b.datasync.sync.SyncJobStatus.RUNNING
        AND j.startedAt < :cutoff
      """)
  List<SyncJob> findStaleRunning(@Param("cutoff") Instant cutoff);

  @Query("SELECT j.cancelRequested FROM SyncJob j WHERE j.id = :id")
  Boolean isCancelRequested(@Param("id") UUID id);

  /** Hands a pending job to exactly one worker. */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE SyncJob j
      SET j.status = io.b2mash.b2b.datasync.sync.SyncJobStatus.RUNNING,
          j.startedAt = :now,
          j.attempts = j.attempts + 1
      WHERE j.id = :id AND j.status = io.b2mash.b2b.datasync.sync.SyncJobStatus.PENDING
      """)
  int claim(@Param("id") UUID id, @Param("now") Instant now);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE SyncJob j
      SET j.status = io.b2mash.b2b.datasync.sync.SyncJobStatus.CANCELLED,
          j.cancelRequested = true,
          j.completedAt = :now
      WHERE j.id = :id AND j.status = io.b2mash.b2b.datasync.sync.SyncJobStatus.PENDING
      """)
  int cancelPending(@Param("id") UUID id, @Param("now") Instant now);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE SyncJob j
      SET j.cancelRequested = true
      WHERE j.id = :id AND j.status = io.b2mash.b2b.datasync.sync.SyncJobStatus.RUNNING
      """)
  int requestCancel(@Param("id") UUID id);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE SyncJob j
      SET j.recordsFetched = :fetched,
          j.recordsProcessed = :processed,
          j.recordsFailed = :failed
      WHERE j.id = :id AND j.status = io.b2mash.b2b.datasync.sync.SyncJobStatus.RUNNING
      """)
  int recordProgress(
      @Param("id") UUID id,
      @Param("fetched") int fetched,
      @Param("processed") int processed,
      @Param("failed") int failed);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE SyncJob j
      SET j.status = io.b2mash.b2b.datasync.sync.SyncJobStatus.COMPLETED,
          j.completedAt = :now
      WHERE j.id = :id AND j.status = io.b2mash.b2b.datasync.sync.SyncJobStatus.RUNNING
      """)
  int complete(@Param("id") UUID id, @Param("now") Instant now);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      value =
          """
          UPDATE sync_jobs
          SET status = 'FAILED',
              error_message = :message,
              error_details = CAST(:details AS jsonb),
              completed_at = :now
          WHERE id = :id AND status = 'RUNNING'
          """,
      nativeQuery = true)
  int fail(
      @Param("id") UUID id,
      @Param("message") String message,
      @Param("details") String detailsJson,
      @Param("now") Instant now);

  /** Used when a queued job could not be handed to a worker. */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      value =
          """
          UPDATE sync_jobs
          SET status = 'FAILED',
              error_message = :message,
              error_details = CAST(:details AS jsonb),
              completed_at = :now
          WHERE id = :id AND status = 'PENDING'
          """,
      nativeQuery = true)
  int failPending(
      @Param("id") UUID id,
      @Param("message") String message,
      @Param("details") String detailsJson,
      @Param("now") Instant now);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE SyncJob j
      SET j.status = io.b2mash.b2b.datasync.sync.SyncJobStatus.CANCELLED,
          j.completedAt = :now
      WHERE j.id = :id AND j.status = io.b2mash.b2b.datasync.sync.SyncJobStatus.RUNNING
      """)
  int finishCancelled(@Param("id") UUID id, @Param("now") Instant now);
}
