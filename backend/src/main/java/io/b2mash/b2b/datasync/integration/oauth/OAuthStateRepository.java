package io.b2mash.b2b.datasync.integration.oauth;

import io.b2mash.b2b.datasync.integration.ProviderType;
import java.time.Instant;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface OAuthStateRepository extends JpaRepository<OAuthState, String> {

  /**
   * Marks the state consumed if it is still unconsumed and unexpired. Exactly one of any number of
   * concurrent callers gets 1.
   */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE OAuthState s
      SET s.consumed = true, s.consumedAt = :now
      WHERE s.state = :state AND s.consumed = false AND s.expiresAt > :now
      """)
  int consume(@Param("state") String state, @Param("now") Instant now);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE OAuthState s
      SET s.consumed = true, s.consumedAt = :now
      WHERE s.tenantId = :tenantId AND s.provider = :provider
        AND s.consumed = false AND s.expiresAt > :now
      """)
  int consumeOpenStates(
      @Param("tenantId") UUID tenantId,
      @Param("provider") ProviderType provider,
      @Param("now") Instant now);

  @Transactional
  @Modifying
  @Query("DELETE FROM OAuthState s WHERE s.expiresAt < :cutoff")
  int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
