package io.b2mash.b2b.datasync.integration;

public enum SyncStatus {
  IDLE,
  SYNCING,
  ERROR
}
