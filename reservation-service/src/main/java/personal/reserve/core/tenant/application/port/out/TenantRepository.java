package personal.reserve.core.tenant.application.port.out;

import personal.reserve.core.tenant.domain.model.Tenant;

import java.util.Optional;

/**
 * Tenant Repository (Output Port)
 */
public interface TenantRepository {

    Optional<Tenant> findById(Long tenantId);

    /**
     * 테넌트 행 잠금 (트랜잭션 종료까지 유지)
     * 테넌트 단위로 직렬화해야 하는 쓰기(최초 고객 생성)에서 사용
     */
    Optional<Tenant> findByIdForUpdate(Long tenantId);
}
