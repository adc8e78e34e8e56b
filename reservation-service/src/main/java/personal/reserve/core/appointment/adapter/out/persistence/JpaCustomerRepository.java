package personal.reserve.core.appointment.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Spring Data JPA Repository for Customer
 */
public interface JpaCustomerRepository extends JpaRepository<CustomerEntity, Long> {

    Optional<CustomerEntity> findByIdAndTenantId(Long id, Long tenantId);

    Optional<CustomerEntity> findByTenantIdAndPhone(Long tenantId, String phone);

    /**
     * 잠금 읽기로 최신 커밋 행을 조회 (REPEATABLE READ 스냅샷 우회)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CustomerEntity c WHERE c.tenantId = :tenantId AND c.phone = :phone")
    Optional<CustomerEntity> findByPhoneForUpdate(@Param("tenantId") Long tenantId,
                                                  @Param("phone") String phone);
}
