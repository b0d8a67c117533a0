package io.b2mash.b2b.datasync.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA value passed to {@link AuditService#log(AuditEventRecord)}. Usually constructed by
 * {@link AuditEventBuilder}, which fills actor, tenant and request metadata.
 *
 * @param tenantId owning tenant; null only for platform-level events
 * @param eventType action following the {@code {resource}.{verb}} convention
 * @param resourceType kind of resource affected (e.g. "integration", "sync_job")
 * @param resourceId ID of the affected resource; not a foreign key
 * @param actorId auth subject of the acting user; null for system-initiated events
 * @param actorType USER, SYSTEM or INTERNAL
 * @param source origin of the action: API, INTERNAL or SCHEDULED
 * @param ipAddress client IP; null for non-HTTP sources
 * @param userAgent truncated User-Agent header; null for non-HTTP sources
 * @param details structured context as JSONB; never contains token material
 */
public record AuditEventRecord(
    UUID tenantId,
    String eventType,
    String resourceType,
    UUID resourceId,
    String actorId,
    String actorType,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {}
