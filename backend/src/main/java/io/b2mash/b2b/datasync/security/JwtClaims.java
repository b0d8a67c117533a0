package io.b2mash.b2b.datasync.security;

import java.util.UUID;
import org.springframework.security.oauth2.jwt.Jwt;

/** Reads the platform claims ({@code tenant_id}, {@code org_role}) from an access token. */
public final class JwtClaims {

  public static final String TENANT_ID = "tenant_id";
  public static final String ORG_ROLE = "org_role";

  /** Returns the tenant UUID, or null when the claim is absent or not a UUID. */
  public static UUID extractTenantId(Jwt jwt) {
    String raw = jwt.getClaimAsString(TENANT_ID);
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return UUID.fromString(raw);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  public static String extractOrgRole(Jwt jwt) {
    return jwt.getClaimAsString(ORG_ROLE);
  }

  private JwtClaims() {}
}
