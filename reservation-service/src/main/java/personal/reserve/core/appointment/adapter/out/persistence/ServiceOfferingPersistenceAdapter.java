package personal.reserve.core.appointment.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.reserve.core.appointment.application.port.out.ServiceOfferingRepository;
import personal.reserve.core.appointment.domain.model.ServiceOffering;

import java.util.Optional;

/**
 * Service Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ServiceOfferingPersistenceAdapter implements ServiceOfferingRepository {

    private final JpaServiceOfferingRepository jpaServiceOfferingRepository;

    @Override
    public Optional<ServiceOffering> findActiveById(Long tenantId, Long serviceId) {
        log.debug("Finding active service: tenantId={}, serviceId={}", tenantId, serviceId);
        return jpaServiceOfferingRepository.findActive(tenantId, serviceId)
                .map(ServiceOfferingEntity::toDomain);
    }

    @Override
    public Optional<ServiceOffering> findActiveByIdForUpdate(Long tenantId, Long serviceId) {
        log.debug("Locking active service: tenantId={}, serviceId={}", tenantId, serviceId);
        return jpaServiceOfferingRepository.findActiveForUpdate(tenantId, serviceId)
                .map(ServiceOfferingEntity::toDomain);
    }

    @Override
    public ServiceOffering save(ServiceOffering service) {
        log.debug("Saving service: serviceId={}, name={}", service.id(), service.name());
        return jpaServiceOfferingRepository.save(ServiceOfferingEntity.fromDomain(service)).toDomain();
    }
}
