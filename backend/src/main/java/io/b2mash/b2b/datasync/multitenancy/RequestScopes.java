package io.b2mash.b2b.datasync.multitenancy;

import io.b2mash.b2b.datasync.exception.MissingTenantContextException;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Request-scoped tenant and caller identity. Bound by {@link TenantFilter} for API requests and by
 * {@link #runAs}/{@link #callAs} on worker threads that act on behalf of a tenant.
 *
 * <p>Values are held in thread locals and must always be cleared in a {@code finally} block; the
 * binding helpers do that for callers.
 */
public final class RequestScopes {

  private static final ThreadLocal<UUID> TENANT_ID = new ThreadLocal<>();
  private static final ThreadLocal<String> USER_ID = new ThreadLocal<>();
  private static final ThreadLocal<String> ORG_ROLE = new ThreadLocal<>();

  private RequestScopes() {}

  public static void bind(UUID tenantId, String userId, String orgRole) {
    TENANT_ID.set(tenantId);
    USER_ID.set(userId);
    ORG_ROLE.set(orgRole);
  }

  public static void clear() {
    TENANT_ID.remove();
    USER_ID.remove();
    ORG_ROLE.remove();
  }

  /** Returns the bound tenant. Throws if no tenant is bound for this thread. */
  public static UUID requireTenantId() {
    UUID tenantId = TENANT_ID.get();
    if (tenantId == null) {
      throw new MissingTenantContextException();
    }
    return tenantId;
  }

  public static UUID getTenantIdOrNull() {
    return TENANT_ID.get();
  }

  public static String getUserIdOrNull() {
    return USER_ID.get();
  }

  /** Returns the authenticated subject. Throws if the request was not authenticated as a user. */
  public static String requireUserId() {
    String userId = USER_ID.get();
    if (userId == null) {
      throw new IllegalStateException("User context not available: USER_ID not bound");
    }
    return userId;
  }

  public static String getOrgRole() {
    return ORG_ROLE.get();
  }

  /**
   * Runs {@code action} with the given tenant bound, restoring the previous binding afterwards.
   * Used by schedulers and sync workers, which have no user.
   */
  public static void runAs(UUID tenantId, Runnable action) {
    UUID previousTenant = TENANT_ID.get();
    String previousUser = USER_ID.get();
    String previousRole = ORG_ROLE.get();
    bind(tenantId, null, null);
    try {
      action.run();
    } finally {
      restore(previousTenant, previousUser, previousRole);
    }
  }

  public static <T> T callAs(UUID tenantId, Callable<T> action) throws Exception {
    UUID previousTenant = TENANT_ID.get();
    String previousUser = USER_ID.get();
    String previousRole = ORG_ROLE.get();
    bind(tenantId, null, null);
    try {
      return action.call();
    } finally {
      restore(previousTenant, previousUser, previousRole);
    }
  }

  private static void restore(UUID tenantId, String userId, String orgRole) {
    if (tenantId == null && userId == null && orgRole == null) {
      clear();
    } else {
      bind(tenantId, userId, orgRole);
    }
  }
}
