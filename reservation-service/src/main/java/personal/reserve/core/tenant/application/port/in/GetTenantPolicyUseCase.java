package personal.reserve.core.tenant.application.port.in;

import personal.reserve.core.tenant.domain.model.BusinessHours;
import personal.reserve.core.tenant.domain.model.OrderPolicy;
import personal.reserve.core.tenant.domain.model.Tenant;

/**
 * Get Tenant Policy UseCase (Input Port)
 * 테넌트 설정과 서비스 기본값을 병합한 정책 조회
 */
public interface GetTenantPolicyUseCase {

    /**
     * @throws personal.reserve.core.tenant.domain.exception.TenantNotFoundException 테넌트가 존재하지 않을 때
     */
    Tenant getTenant(Long tenantId);

    /**
     * 영업 시간과 슬롯 간격 (기본: 09:00-18:00, 30분)
     */
    BusinessHours getBusinessHours(Long tenantId);

    /**
     * 주문당 티켓 수량 한도와 예약 유지 시간 (기본: 1-50장, 15분)
     */
    OrderPolicy getOrderPolicy(Long tenantId);
}
