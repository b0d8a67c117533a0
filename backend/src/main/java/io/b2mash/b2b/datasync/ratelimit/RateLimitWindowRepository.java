package io.b2mash.b2b.datasync.ratelimit;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface RateLimitWindowRepository extends JpaRepository<RateLimitWindow, UUID> {

  Optional<RateLimitWindow> findByIntegrationIdAndWindowStart(
      UUID integrationId, Instant windowStart);

  /** Creates the window row with zero usage unless it already exists. */
  @Transactional
  @Modifying
  @Query(
      value =
          """
          INSERT INTO rate_limit_windows
              (id, integration_id, window_start, window_end, requests_made, requests_limit, created_at)
          VALUES (gen_random_uuid(), :integrationId, :windowStart, :windowEnd, 0, :limit, :now)
          ON CONFLICT (integration_id, window_start) DO NOTHING
          """,
      nativeQuery = true)
  int insertIfAbsent(
      @Param("integrationId") UUID integrationId,
      @Param("windowStart") Instant windowStart,
      @Param("windowEnd") Instant windowEnd,
      @Param("limit") int limit,
      @Param("now") Instant now);

  /**
   * Adds {@code cost} to the window's usage only if the result stays within the limit. Concurrent
   * callers serialize on the row lock and each re-evaluates the cap against the committed count.
   *
   * @return 1 when granted, 0 when the budget is exhausted
   */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE RateLimitWindow w
      SET w.requestsMade = w.requestsMade + :cost
      WHERE w.integrationId = :integrationId
        AND w.windowStart = :windowStart
        AND w.requestsMade + :cost <= w.requestsLimit
      """)
  int incrementWithinLimit(
      @Param("integrationId") UUID integrationId,
      @Param("windowStart") Instant windowStart,
      @Param("cost") int cost);

  @Transactional
  @Modifying
  @Query("DELETE FROM RateLimitWindow w WHERE w.windowEnd < :cutoff")
  int deleteEndedBefore(@Param("cutoff") Instant cutoff);
}
