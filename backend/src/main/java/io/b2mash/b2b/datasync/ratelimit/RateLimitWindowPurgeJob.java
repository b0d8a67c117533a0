package io.b2mash.b2b.datasync.ratelimit;

import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RateLimitWindowPurgeJob {

  private static final Logger log = LoggerFactory.getLogger(RateLimitWindowPurgeJob.class);

  private final RateLimitWindowRepository windowRepository;
  private final Duration retention;
  private final Clock clock;

  public RateLimitWindowPurgeJob(
      RateLimitWindowRepository windowRepository,
      @Value("${datasync.rate-limit.retention:2d}") Duration retention,
      Clock clock) {
    this.windowRepository = windowRepository;
    this.retention = retention;
    this.clock = clock;
  }

  @Scheduled(cron = "${datasync.rate-limit.purge-cron:0 30 3 * * *}")
  public void purgeOldWindows() {
    int deleted = windowRepository.deleteEndedBefore(clock.instant().minus(retention));
    if (deleted > 0) {
      log.info("Purged {} rate limit windows older than {}", deleted, retention);
    }
  }
}
