package io.b2mash.b2b.datasync.security;

/**
 * Role constants shared by authentication and {@code @PreAuthorize} rules.
 *
 * <p>Org roles come from the {@code org_role} JWT claim; Spring authorities are the {@code ROLE_}
 * prefixed versions.
 */
public final class Roles {

  public static final String ORG_OWNER = "owner";
  public static final String ORG_ADMIN = "admin";
  public static final String ORG_MEMBER = "member";

  public static final String AUTHORITY_ORG_OWNER = "ROLE_ORG_OWNER";
  public static final String AUTHORITY_ORG_ADMIN = "ROLE_ORG_ADMIN";
  public static final String AUTHORITY_ORG_MEMBER = "ROLE_ORG_MEMBER";
  public static final String AUTHORITY_INTERNAL = "ROLE_INTERNAL_SERVICE";

  public static final String MANAGE_INTEGRATIONS = "hasAnyRole('ORG_OWNER', 'ORG_ADMIN')";
  public static final String VIEW_INTEGRATIONS =
      "hasAnyRole('ORG_OWNER', 'ORG_ADMIN', 'ORG_MEMBER')";

  private Roles() {}
}
