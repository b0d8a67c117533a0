package io.b2mash.b2b.datasync.sync;

public enum SyncJobKind {
  FULL,
  INCREMENTAL,
  MANUAL
}
