package io.b2mash.b2b.datasync.sync;

import java.util.UUID;

/** Published inside the transaction that inserted a pending job. */
public record SyncJobQueuedEvent(UUID jobId, UUID tenantId, UUID integrationId) {}
