package io.b2mash.b2b.datasync.sync;

import io.b2mash.b2b.datasync.sync.SyncCancellationRegistry.CancellationHandle;
import java.time.Duration;

/** Waits between attempts of a sync job. Returns early when the job is cancelled. */
@FunctionalInterface
public interface JobSleeper {

  void sleep(Duration duration, CancellationHandle handle) throws InterruptedException;

  static JobSleeper latchBacked() {
    return (duration, handle) -> handle.await(duration);
  }
}
