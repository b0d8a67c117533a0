package io.b2mash.b2b.datasync.sync;

/** Unwinds a running job after a cancellation request was observed. */
class SyncCancelledException extends RuntimeException {

  SyncCancelledException() {
    super("Sync job was cancelled", null, false, false);
  }
}
