package io.b2mash.b2b.datasync.audit;

import io.b2mash.b2b.datasync.multitenancy.RequestScopes;
import io.b2mash.b2b.datasync.security.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builds an {@link AuditEventRecord}, filling tenant, actor, source, IP address and user agent from
 * the current request scope when they are not set explicitly.
 *
 * <pre>{@code
 * auditService.log(
 *     AuditEventBuilder.builder()
 *         .eventType("integration.connected")
 *         .resourceType("integration")
 *         .resourceId(integration.getId())
 *         .details(Map.of("provider", "ecommerce"))
 *         .build());
 * }</pre>
 */
public class AuditEventBuilder {

  static final int MAX_USER_AGENT_LENGTH = 500;

  private UUID tenantId;
  private String eventType;
  private String resourceType;
  private UUID resourceId;
  private String actorId;
  private String actorType;
  private String source;
  private Map<String, Object> details;

  private boolean tenantIdExplicitlySet;
  private boolean actorIdExplicitlySet;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder tenantId(UUID tenantId) {
    this.tenantId = tenantId;
    this.tenantIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder resourceType(String resourceType) {
    this.resourceType = resourceType;
    return this;
  }

  public AuditEventBuilder resourceId(UUID resourceId) {
    this.resourceId = resourceId;
    return this;
  }

  public AuditEventBuilder actorId(String actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder actorType(String actorType) {
    this.actorType = actorType;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Resolves unset fields:
   *
   * <ul>
   *   <li>{@code tenantId} from {@link RequestScopes#getTenantIdOrNull()}
   *   <li>{@code actorId} from the authenticated subject, if any
   *   <li>{@code actorType} = "USER" when a subject is known, "SYSTEM" otherwise
   *   <li>{@code source} = "API" inside an HTTP request, "INTERNAL" otherwise
   *   <li>{@code ipAddress} and {@code userAgent} (truncated to 500 chars) from the request
   * </ul>
   */
  public AuditEventRecord build() {
    UUID resolvedTenant = tenantIdExplicitlySet ? tenantId : RequestScopes.getTenantIdOrNull();
    String resolvedActorId = actorIdExplicitlySet ? actorId : RequestScopes.getUserIdOrNull();

    String resolvedActorType = actorType;
    if (resolvedActorType == null) {
      resolvedActorType = resolvedActorId != null ? "USER" : "SYSTEM";
    }

    HttpServletRequest request = resolveHttpRequest();

    String resolvedSource = source;
    if (resolvedSource == null) {
      resolvedSource = request != null ? "API" : "INTERNAL";
    }

    String ipAddress = null;
    String userAgent = null;
    if (request != null) {
      ipAddress = ClientIpResolver.clientIp(request);
      userAgent = truncate(request.getHeader("User-Agent"));
    }

    return new AuditEventRecord(
        resolvedTenant,
        eventType,
        resourceType,
        resourceId,
        resolvedActorId,
        resolvedActorType,
        resolvedSource,
        ipAddress,
        userAgent,
        details);
  }

  static String truncate(String userAgent) {
    if (userAgent != null && userAgent.length() > MAX_USER_AGENT_LENGTH) {
      return userAgent.substring(0, MAX_USER_AGENT_LENGTH);
    }
    return userAgent;
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
