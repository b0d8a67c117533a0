package io.b2mash.b2b.datasync.sync.record;

import io.b2mash.b2b.datasync.integration.provider.ProviderRecord;
import io.b2mash.b2b.datasync.sync.SyncJob;
import java.util.List;

/** Destination of the records a sync job pulls from a provider. */
public interface SyncRecordSink {

  /**
   * Stores one page atomically. Records that cannot be stored are counted, not thrown, so one bad
   * record does not fail the job.
   */
  PageWriteResult write(SyncJob job, List<ProviderRecord> records);

  record PageWriteResult(int processed, int failed) {}
}
