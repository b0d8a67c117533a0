package io.b2mash.b2b.datasync.sync;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a sync job: {@code PENDING -> RUNNING -> COMPLETED | FAILED | CANCELLED}, or {@code
 * PENDING -> CANCELLED}. Terminal states are final.
 */
public enum SyncJobStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED,
  CANCELLED;

  /** Statuses covered by the one-active-job-per-integration index. */
  public static final Set<SyncJobStatus> ACTIVE = EnumSet.of(PENDING, RUNNING);

  public boolean isTerminal() {
    return !ACTIVE.contains(this);
  }

  /** Lowercase form used in API responses, e.g. {@code "pending"}. */
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
