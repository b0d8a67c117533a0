package io.b2mash.b2b.datasync.multitenancy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.b2b.datasync.security.JwtClaims;
import io.b2mash.b2b.datasync.tenant.TenantRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds {@link RequestScopes} from the JWT's {@code tenant_id} claim. Requests for unknown or
 * deactivated tenants are rejected with 403.
 */
@Component
public class TenantFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(TenantFilter.class);

  private final TenantRepository tenantRepository;
  private final Cache<UUID, Boolean> activeCache =
      Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofMinutes(5)).build();

  public TenantFilter(TenantRepository tenantRepository) {
    this.tenantRepository = tenantRepository;
  }

  /** Drops the cached active flag so a deactivation takes effect on the next request. */
  public void evictTenant(UUID tenantId) {
    activeCache.invalidate(tenantId);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

    if (authentication instanceof JwtAuthenticationToken jwtAuth) {
      Jwt jwt = jwtAuth.getToken();
      UUID tenantId = JwtClaims.extractTenantId(jwt);

      if (tenantId != null) {
        if (!isActive(tenantId)) {
          log.warn("Rejected request for inactive or unknown tenant {}", tenantId);
          response.sendError(HttpServletResponse.SC_FORBIDDEN, "Tenant is not active");
          return;
        }
        RequestScopes.bind(tenantId, jwt.getSubject(), JwtClaims.extractOrgRole(jwt));
        try {
          filterChain.doFilter(request, response);
        } finally {
          RequestScopes.clear();
        }
        return;
      }
    }

    // No JWT or no tenant claim: continue unbound (actuator, OAuth callback)
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path.startsWith("/internal/") || path.startsWith("/actuator/");
  }

  private boolean isActive(UUID tenantId) {
    // Caffeine's cache.get(key, loader) throws NPE if the loader returns null, so unknown
    // tenants are looked up every time instead of being cached.
    Boolean cached = activeCache.getIfPresent(tenantId);
    if (cached != null) {
      return cached;
    }
    Boolean active = tenantRepository.findActiveById(tenantId);
    if (active == null) {
      return false;
    }
    activeCache.put(tenantId, active);
    return active;
  }
}
