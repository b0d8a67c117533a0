package io.b2mash.b2b.datasync.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Sync engine tuning. Delays follow {@code initialBackoff * 2^attempt} with random jitter, capped
 * at {@code maxBackoff}.
 *
 * @param jobTimeout wall-clock budget of a single sync job
 * @param maxAttempts provider calls per page before a transient failure becomes terminal
 * @param initialBackoff delay before the first retry
 * @param maxBackoff upper bound of a single retry delay
 * @param refreshSkew tokens expiring within this window are refreshed before a job starts
 * @param refreshLookAhead window used by the scheduled proactive refresh
 * @param pageSize page size requested from providers
 * @param staleJobGrace extra time past the job timeout before a running job is reaped
 * @param executor worker pool sizing
 */
@ConfigurationProperties(prefix = "datasync.sync")
public record SyncProperties(
    @DefaultValue("10m") Duration jobTimeout,
    @DefaultValue("3") int maxAttempts,
    @DefaultValue("1s") Duration initialBackoff,
    @DefaultValue("30s") Duration maxBackoff,
    @DefaultValue("5m") Duration refreshSkew,
    @DefaultValue("30m") Duration refreshLookAhead,
    @DefaultValue("100") int pageSize,
    @DefaultValue("5m") Duration staleJobGrace,
    @DefaultValue Executor executor) {

  public record Executor(
      @DefaultValue("4") int corePoolSize,
      @DefaultValue("8") int maxPoolSize,
      @DefaultValue("100") int queueCapacity) {}
}
