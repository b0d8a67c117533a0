package io.b2mash.b2b.datasync.integration.oauth;

import io.b2mash.b2b.datasync.config.OAuthProperties;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/** Deletes OAuth states that expired longer ago than the configured retention. */
@Component
public class OAuthStateCleanupJob {

  private static final Logger log = LoggerFactory.getLogger(OAuthStateCleanupJob.class);

  private final OAuthStateRepository stateRepository;
  private final OAuthProperties oauthProperties;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public OAuthStateCleanupJob(
      OAuthStateRepository stateRepository,
      OAuthProperties oauthProperties,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.stateRepository = stateRepository;
    this.oauthProperties = oauthProperties;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  @Scheduled(cron = "${datasync.oauth.cleanup-cron:0 */15 * * * *}")
  public void purgeExpiredStates() {
    Instant cutoff = clock.instant().minus(oauthProperties.stateRetention());
    Integer deleted =
        transactionTemplate.execute(status -> stateRepository.deleteExpiredBefore(cutoff));
    if (deleted != null && deleted > 0) {
      log.info("Purged {} expired OAuth states", deleted);
    }
  }
}
