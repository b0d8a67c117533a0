package io.b2mash.b2b.datasync.tenant;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Tenant lifecycle hooks for the signup and billing services, behind the internal API key. */
@RestController
@RequestMapping("/internal/tenants")
public class InternalTenantController {

  private static final Logger log = LoggerFactory.getLogger(InternalTenantController.class);

  private final TenantService tenantService;

  public InternalTenantController(TenantService tenantService) {
    this.tenantService = tenantService;
  }

  @PostMapping
  public ResponseEntity<TenantResponse> createTenant(
      @Valid @RequestBody CreateTenantRequest request) {
    log.info("Received tenant creation request for subdomain {}", request.subdomain());
    var tenant =
        tenantService.createTenant(
            request.name(), request.subdomain(), request.ownerUserId(), request.tier());
    return ResponseEntity.created(URI.create("/internal/tenants/" + tenant.getId()))
        .body(TenantResponse.from(tenant));
  }

  @PostMapping("/{id}/deactivate")
  public ResponseEntity<TenantResponse> deactivateTenant(@PathVariable UUID id) {
    return ResponseEntity.ok(TenantResponse.from(tenantService.deactivateTenant(id)));
  }

  public record CreateTenantRequest(
      @NotBlank(message = "name is required") String name,
      @NotBlank(message = "subdomain is required") String subdomain,
      @NotBlank(message = "ownerUserId is required") String ownerUserId,
      SubscriptionTier tier) {}

  public record TenantResponse(
      UUID id,
      String name,
      String subdomain,
      String ownerUserId,
      boolean active,
      SubscriptionTier tier,
      Instant createdAt) {

    static TenantResponse from(Tenant tenant) {
      return new TenantResponse(
          tenant.getId(),
          tenant.getName(),
          tenant.getSubdomain(),
          tenant.getOwnerUserId(),
          tenant.isActive(),
          tenant.getTier(),
          tenant.getCreatedAt());
    }
  }
}
