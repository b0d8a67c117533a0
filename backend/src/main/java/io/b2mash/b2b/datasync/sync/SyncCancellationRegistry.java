package io.b2mash.b2b.datasync.sync;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

/**
 * Cancellation handles of the jobs running in this instance. Cancelling through the registry wakes
 * a worker that is sleeping in a backoff or waiting for the next rate-limit window. Jobs running
 * elsewhere see the persisted {@code cancel_requested} flag at their next checkpoint instead.
 */
@Component
public class SyncCancellationRegistry {

  private final Map<UUID, CancellationHandle> handles = new ConcurrentHashMap<>();

  public CancellationHandle register(UUID jobId) {
    return handles.computeIfAbsent(jobId, id -> new CancellationHandle());
  }

  public void unregister(UUID jobId) {
    handles.remove(jobId);
  }

  /** @return true if the job runs in this instance */
  public boolean cancel(UUID jobId) {
    var handle = handles.get(jobId);
    if (handle == null) {
      return false;
    }
    handle.cancel();
    return true;
  }

  public static final class CancellationHandle {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void cancel() {
      latch.countDown();
    }

    public boolean isCancelled() {
      return latch.getCount() == 0;
    }

    /**
     * Blocks for up to {@code timeout}.
     *
     * @return true if the handle was cancelled before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
      return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
  }
}
