package personal.reserve.core.appointment.application.port.out;

import personal.reserve.core.appointment.domain.model.ServiceOffering;

import java.util.Optional;

/**
 * Service Offering Repository (Output Port)
 */
public interface ServiceOfferingRepository {

    /**
     * 테넌트의 활성 서비스 조회
     */
    Optional<ServiceOffering> findActiveById(Long tenantId, Long serviceId);

    /**
     * 테넌트의 활성 서비스 조회 (비관적 락 - SELECT ... FOR UPDATE)
     * 같은 서비스에 대한 예약 생성을 직렬화
     */
    Optional<ServiceOffering> findActiveByIdForUpdate(Long tenantId, Long serviceId);

    ServiceOffering save(ServiceOffering service);
}
