package personal.reserve.core.appointment.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Spring Data JPA Repository for Service
 */
public interface JpaServiceOfferingRepository extends JpaRepository<ServiceOfferingEntity, Long> {

    @Query("SELECT s FROM ServiceOfferingEntity s " +
            "WHERE s.id = :serviceId AND s.tenantId = :tenantId AND s.active = true")
    Optional<ServiceOfferingEntity> findActive(@Param("tenantId") Long tenantId,
                                               @Param("serviceId") Long serviceId);

    /**
     * 서비스 조회 (SELECT ... FOR UPDATE)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ServiceOfferingEntity s " +
            "WHERE s.id = :serviceId AND s.tenantId = :tenantId AND s.active = true")
    Optional<ServiceOfferingEntity> findActiveForUpdate(@Param("tenantId") Long tenantId,
                                                        @Param("serviceId") Long serviceId);
}
