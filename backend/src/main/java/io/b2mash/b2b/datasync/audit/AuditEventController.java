package io.b2mash.b2b.datasync.audit;

import io.b2mash.b2b.datasync.security.Roles;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuditEventController {

  private final AuditService auditService;

  public AuditEventController(AuditService auditService) {
    this.auditService = auditService;
  }

  @GetMapping("/api/audit-events")
  @PreAuthorize(Roles.MANAGE_INTEGRATIONS)
  public ResponseEntity<Page<AuditEventResponse>> listAuditEvents(
      @RequestParam(required = false) String resourceType,
      @RequestParam(required = false) UUID resourceId,
      @RequestParam(required = false) String actorId,
      @RequestParam(required = false) String eventType,
      @RequestParam(required = false) Instant from,
      @RequestParam(required = false) Instant to,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {

    var filter = new AuditEventFilter(resourceType, resourceId, actorId, eventType, from, to);
    var pageable =
        PageRequest.of(page, Math.min(size, 200), Sort.by(Sort.Direction.DESC, "occurredAt"));
    var events = auditService.findEvents(filter, pageable);
    return ResponseEntity.ok(events.map(AuditEventResponse::from));
  }

  public record AuditEventResponse(
      UUID id,
      String eventType,
      String resourceType,
      UUID resourceId,
      String actorId,
      String actorType,
      String source,
      String ipAddress,
      Map<String, Object> details,
      Instant occurredAt) {

    public static AuditEventResponse from(AuditEvent event) {
      return new AuditEventResponse(
          event.getId(),
          event.getEventType(),
          event.getResourceType(),
          event.getResourceId(),
          event.getActorId(),
          event.getActorType(),
          event.getSource(),
          event.getIpAddress(),
          event.getDetails(),
          event.getOccurredAt());
    }
  }
}
