package io.b2mash.b2b.datasync.integration.token;

import io.b2mash.b2b.datasync.config.SyncProperties;
import io.b2mash.b2b.datasync.integration.IntegrationRepository;
import io.b2mash.b2b.datasync.multitenancy.RequestScopes;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes tokens that expire within the look-ahead window so sync jobs rarely have to refresh on
 * their critical path.
 */
@Component
public class TokenRefreshScheduledJob {

  private static final Logger log = LoggerFactory.getLogger(TokenRefreshScheduledJob.class);

  private final IntegrationRepository integrationRepository;
  private final TokenRefresher tokenRefresher;
  private final SyncProperties syncProperties;
  private final Clock clock;

  public TokenRefreshScheduledJob(
      IntegrationRepository integrationRepository,
      TokenRefresher tokenRefresher,
      SyncProperties syncProperties,
      Clock clock) {
    this.integrationRepository = integrationRepository;
    this.tokenRefresher = tokenRefresher;
    this.syncProperties = syncProperties;
    this.clock = clock;
  }

  @Scheduled(cron = "${datasync.sync.schedule.token-refresh-cron:0 */10 * * * *}")
  public void refreshExpiringTokens() {
    var expiring =
        integrationRepository.findExpiringBefore(
            clock.instant().plus(syncProperties.refreshLookAhead()));
    int refreshed = 0;

    for (var integration : expiring) {
      MDC.put("integrationId", integration.getId().toString());
      try {
        RequestScopes.runAs(
            integration.getTenantId(),
            () ->
                tokenRefresher.refreshIfExpiringWithin(
                    integration, syncProperties.refreshLookAhead()));
        refreshed++;
      } catch (Exception e) {
        log.warn(
            "Proactive token refresh failed for integration {}: {}",
            integration.getId(),
            e.getMessage());
      } finally {
        MDC.remove("integrationId");
      }
    }

    if (!expiring.isEmpty()) {
      log.info(
          "Proactive token refresh: {} of {} integrations refreshed", refreshed, expiring.size());
    }
  }
}
