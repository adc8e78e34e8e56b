package personal.reserve.core.tenant.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Spring Data JPA Repository for Tenant
 */
public interface JpaTenantRepository extends JpaRepository<TenantEntity, Long> {

    /**
     * 테넌트 조회 (SELECT ... FOR UPDATE)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TenantEntity t WHERE t.id = :tenantId")
    Optional<TenantEntity> findByIdForUpdate(@Param("tenantId") Long tenantId);
}
