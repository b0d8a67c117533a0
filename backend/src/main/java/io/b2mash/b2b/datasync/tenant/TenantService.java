package io.b2mash.b2b.datasync.tenant;

import io.b2mash.b2b.datasync.audit.AuditEventBuilder;
import io.b2mash.b2b.datasync.audit.AuditService;
import io.b2mash.b2b.datasync.exception.InvalidStateException;
import io.b2mash.b2b.datasync.exception.ResourceConflictException;
import io.b2mash.b2b.datasync.exception.ResourceNotFoundException;
import io.b2mash.b2b.datasync.multitenancy.TenantFilter;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TenantService {

  private static final Logger log = LoggerFactory.getLogger(TenantService.class);

  static final Pattern SUBDOMAIN = Pattern.compile("^[a-z0-9]+(-[a-z0-9]+)*$");

  private final TenantRepository tenantRepository;
  private final AuditService auditService;
  private final TenantFilter tenantFilter;

  public TenantService(
      TenantRepository tenantRepository, AuditService auditService, TenantFilter tenantFilter) {
    this.tenantRepository = tenantRepository;
    this.auditService = auditService;
    this.tenantFilter = tenantFilter;
  }

  @Transactional
  public Tenant createTenant(
      String name, String subdomain, String ownerUserId, SubscriptionTier tier) {
    if (subdomain == null
        || subdomain.length() < 3
        || subdomain.length() > 63
        || !SUBDOMAIN.matcher(subdomain).matches()) {
      throw new InvalidStateException(
          "Invalid subdomain",
          "Subdomain must be 3-63 lowercase letters, digits or inner hyphens");
    }
    if (tenantRepository.existsBySubdomain(subdomain)) {
      throw new ResourceConflictException(
          "Subdomain taken", "Subdomain '" + subdomain + "' is already in use");
    }

    Tenant tenant;
    try {
      tenant = tenantRepository.saveAndFlush(new Tenant(name, subdomain, ownerUserId, tier));
    } catch (DataIntegrityViolationException e) {
      throw new ResourceConflictException(
          "Subdomain taken", "Subdomain '" + subdomain + "' is already in use");
    }
    log.info("Created tenant {} ({})", tenant.getId(), subdomain);

    auditService.log(
        AuditEventBuilder.builder()
            .tenantId(tenant.getId())
            .eventType("tenant.created")
            .resourceType("tenant")
            .resourceId(tenant.getId())
            .details(Map.of("subdomain", subdomain, "tier", tenant.getTier().name()))
            .build());
    return tenant;
  }

  @Transactional
  public Tenant deactivateTenant(UUID tenantId) {
    var tenant =
        tenantRepository
            .findById(tenantId)
            .orElseThrow(() -> new ResourceNotFoundException("Tenant", tenantId));
    if (!tenant.isActive()) {
      return tenant;
    }
    tenant.deactivate();
    tenantFilter.evictTenant(tenantId);
    log.info("Deactivated tenant {}", tenantId);

    auditService.log(
        AuditEventBuilder.builder()
            .tenantId(tenantId)
            .eventType("tenant.deactivated")
            .resourceType("tenant")
            .resourceId(tenantId)
            .build());
    return tenant;
  }
}
