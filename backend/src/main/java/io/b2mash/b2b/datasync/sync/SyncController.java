package io.b2mash.b2b.datasync.sync;

import io.b2mash.b2b.datasync.security.Roles;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/integrations/{integrationId}/sync")
public class SyncController {

  private final SyncService syncService;

  public SyncController(SyncService syncService) {
    this.syncService = syncService;
  }

  /** Queues a job and returns before any provider call is made. */
  @PostMapping
  @PreAuthorize(Roles.MANAGE_INTEGRATIONS)
  public ResponseEntity<SyncJobResponse> triggerSync(
      @PathVariable UUID integrationId, @RequestBody(required = false) TriggerSyncRequest request) {
    var kind = request != null && request.kind() != null ? request.kind() : SyncJobKind.MANUAL;
    var params =
        request != null
            ? new SyncParams(request.since(), request.until(), request.filters())
            : SyncParams.empty();
    var job = syncService.triggerSync(integrationId, kind, params);
    return ResponseEntity.accepted().body(SyncJobResponse.from(job));
  }

  @GetMapping
  @PreAuthorize(Roles.VIEW_INTEGRATIONS)
  public ResponseEntity<Page<SyncJobResponse>> listJobs(
      @PathVariable UUID integrationId,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {
    var pageable =
        PageRequest.of(page, Math.min(size, 100), Sort.by(Sort.Direction.DESC, "createdAt"));
    return ResponseEntity.ok(
        syncService.listJobs(integrationId, pageable).map(SyncJobResponse::from));
  }

  @GetMapping("/{jobId}")
  @PreAuthorize(Roles.VIEW_INTEGRATIONS)
  public ResponseEntity<SyncJobResponse> getJob(
      @PathVariable UUID integrationId, @PathVariable UUID jobId) {
    return ResponseEntity.ok(SyncJobResponse.from(syncService.getJob(integrationId, jobId)));
  }

  @PostMapping("/{jobId}/cancel")
  @PreAuthorize(Roles.MANAGE_INTEGRATIONS)
  public ResponseEntity<SyncJobResponse> cancelJob(
      @PathVariable UUID integrationId, @PathVariable UUID jobId) {
    return ResponseEntity.ok(SyncJobResponse.from(syncService.cancelSync(integrationId, jobId)));
  }

  public record TriggerSyncRequest(
      SyncJobKind kind, Instant since, Instant until, Map<String, Object> filters) {}

  public record SyncJobResponse(
      UUID jobId,
      UUID integrationId,
      String kind,
      String status,
      Instant createdAt,
      Instant startedAt,
      Instant completedAt,
      int recordsFetched,
      int recordsProcessed,
      int recordsFailed,
      String errorMessage,
      Map<String, Object> errorDetails,
      Map<String, Object> params,
      boolean cancelRequested) {

    public static SyncJobResponse from(SyncJob job) {
      return new SyncJobResponse(
          job.getId(),
          job.getIntegrationId(),
          job.getKind().name().toLowerCase(Locale.ROOT),
          job.getStatus().wireValue(),
          job.getCreatedAt(),
          job.getStartedAt(),
          job.getCompletedAt(),
          job.getRecordsFetched(),
          job.getRecordsProcessed(),
          job.getRecordsFailed(),
          job.getErrorMessage(),
          job.getErrorDetails(),
          job.getParams(),
          job.isCancelRequested());
    }
  }
}
