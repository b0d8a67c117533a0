package io.b2mash.b2b.datasync.tenant;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TenantRepository extends JpaRepository<Tenant, UUID> {

  boolean existsBySubdomain(String subdomain);

  /** Null when the tenant does not exist. */
  @Query("SELECT t.active FROM Tenant t WHERE t.id = :id")
  Boolean findActiveById(@Param("id") UUID id);
}
