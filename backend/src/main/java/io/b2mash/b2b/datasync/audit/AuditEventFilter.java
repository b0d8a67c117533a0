package io.b2mash.b2b.datasync.audit;

import java.time.Instant;
import java.util.UUID;

/**
 * Query filter for {@link AuditService#findEvents}. Null fields are not filtered on.
 *
 * @param eventType prefix match, so "sync." matches sync.completed and sync.failed
 * @param from inclusive lower bound
 * @param to exclusive upper bound
 */
public record AuditEventFilter(
    String resourceType,
    UUID resourceId,
    String actorId,
    String eventType,
    Instant from,
    Instant to) {}
