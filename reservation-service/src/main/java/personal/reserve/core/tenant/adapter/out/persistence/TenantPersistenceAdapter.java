package personal.reserve.core.tenant.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.reserve.core.tenant.application.port.out.TenantRepository;
import personal.reserve.core.tenant.domain.model.Tenant;

import java.util.Optional;

/**
 * Tenant Persistence Adapter
 * JPA를 사용한 테넌트 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TenantPersistenceAdapter implements TenantRepository {

    private final JpaTenantRepository jpaTenantRepository;

    @Override
    public Optional<Tenant> findById(Long tenantId) {
        log.debug("Finding tenant by id: {}", tenantId);
        return jpaTenantRepository.findById(tenantId)
                .map(TenantEntity::toDomain);
    }

    @Override
    public Optional<Tenant> findByIdForUpdate(Long tenantId) {
        log.debug("Locking tenant: {}", tenantId);
        return jpaTenantRepository.findByIdForUpdate(tenantId)
                .map(TenantEntity::toDomain);
    }
}
