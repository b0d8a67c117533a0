package io.b2mash.b2b.datasync.integration;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/**
 * Status and token writes are single conditional statements that also bump {@code version}, so a
 * concurrent entity-level save fails its optimistic check instead of overwriting them.
 */
public interface IntegrationRepository extends JpaRepository<Integration, UUID> {

  Optional<Integration> findByIdAndTenantId(UUID id, UUID tenantId);

  List<Integration> findByTenantIdOrderByCreatedAtAsc(UUID tenantId);

  Optional<Integration> findByTenantIdAndProviderAndExternalAccountId(
      UUID tenantId, ProviderType provider, String externalAccountId);

  /**
   * Replaces the token pair if nobody rotated it since {@code expectedTokenVersion} was read.
   *
   * @return 1 when applied, 0 when the stored pair moved on or the integration was disconnected
   */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Integration i
      SET i.accessToken = :accessToken,
          i.refreshToken = :refreshToken,
          i.expiresAt = :expiresAt,
          i.tokenVersion = i.tokenVersion + 1,
          i.version = i.version + 1,
          i.updatedAt = :now
      WHERE i.id = :id AND i.tokenVersion = :expectedTokenVersion AND i.active = true
      """)
  int rotateTokens(
      @Param("id") UUID id,
      @Param("expectedTokenVersion") long expectedTokenVersion,
      @Param("accessToken") String accessToken,
      @Param("refreshToken") String refreshToken,
      @Param("expiresAt") Instant expiresAt,
      @Param("now") Instant now);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Integration i
      SET i.active = false,
          i.accessToken = NULL,
          i.refreshToken = NULL,
          i.expiresAt = NULL,
          i.tokenVersion = i.tokenVersion + 1,
          i.syncStatus = io.b2mash.b2b.datasync.integration.SyncStatus.IDLE,
          i.disconnectedAt = :now,
          i.version = i.version + 1,
          i.updatedAt = :now
      WHERE i.id = :id AND i.active = true
      """)
  int deactivate(@Param("id") UUID id, @Param("now") Instant now);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Integration i
      SET i.syncStatus = io.b2mash.b2b.datasync.integration.SyncStatus.SYNCING,
          i.version = i.version + 1,
          i.updatedAt = :now
      WHERE i.id = :id
      """)
  int markSyncing(@Param("id") UUID id, @Param("now") Instant now);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Integration i
      SET i.syncStatus = io.b2mash.b2b.datasync.integration.SyncStatus.IDLE,
          i.errorCategory = NULL,
          i.lastError = NULL,
          i.lastSyncedAt = :syncedAt,
          i.version = i.version + 1,
          i.updatedAt = :syncedAt
      WHERE i.id = :id
      """)
  int markSyncSucceeded(@Param("id") UUID id, @Param("syncedAt") Instant syncedAt);

  /** Leaves an earlier error in place; only a successful sync or a reconnect clears it. */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Integration i
      SET i.syncStatus = CASE WHEN i.errorCategory IS NULL
                              THEN io.b2mash.b2b.datasync.integration.SyncStatus.IDLE
                              ELSE io.b2mash.b2b.datasync.integration.SyncStatus.ERROR END,
          i.version = i.version + 1,
          i.updatedAt = :now
      WHERE i.id = :id
      """)
  int markSyncStopped(@Param("id") UUID id, @Param("now") Instant now);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Integration i
      SET i.syncStatus = io.b2mash.b2b.datasync.integration.SyncStatus.ERROR,
          i.errorCategory = :category,
          i.lastError = :error,
          i.version = i.version + 1,
          i.updatedAt = :now
      WHERE i.id = :id
      """)
  int markFailed(
      @Param("id") UUID id,
      @Param("category") ErrorCategory category,
      @Param("error") String error,
      @Param("now") Instant now);

  /** Active, reconnectable integrations whose access token expires before {@code threshold}. */
  @Query(
      """
      SELECT i FROM Integration i
      WHERE i.active = true
        AND i.refreshToken IS NOT NULL
        AND i.expiresAt IS NOT NULL
        AND i.expiresAt < :threshold
        AND (i.errorCategory IS NULL
             OR i.errorCategory <> io.b2mash.b2b.datasync.integration.ErrorCategory.RECONNECT_REQUIRED)
      """)
  List<Integration> findExpiringBefore(@Param("threshold") Instant threshold);

  @Query(
      """
      SELECT i FROM Integration i
      WHERE i.active = true
        AND (i.errorCategory IS NULL
             OR i.errorCategory <> io.b2mash.b2b.datasync.integration.ErrorCategory.RECONNECT_REQUIRED)
      """)
  List<Integration> findSyncable();
}
