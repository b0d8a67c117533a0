package io.b2mash.b2b.datasync.sync;

import java.time.Duration;

class SyncTimeoutException extends RuntimeException {

  SyncTimeoutException(Duration timeout) {
    super("Sync job exceeded its time limit of " + timeout.toSeconds() + "s");
  }
}
