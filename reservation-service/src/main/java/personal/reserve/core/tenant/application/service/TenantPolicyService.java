package personal.reserve.core.tenant.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.reserve.core.config.ReservationProperties;
import personal.reserve.core.tenant.application.port.in.GetTenantPolicyUseCase;
import personal.reserve.core.tenant.application.port.out.TenantRepository;
import personal.reserve.core.tenant.domain.exception.TenantNotFoundException;
import personal.reserve.core.tenant.domain.model.BusinessHours;
import personal.reserve.core.tenant.domain.model.OrderPolicy;
import personal.reserve.core.tenant.domain.model.Tenant;
import personal.reserve.core.tenant.domain.model.TenantSettings;

/**
 * Tenant Policy Service
 * 테넌트 설정 값이 없으면 reservation.* 기본값을 사용
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TenantPolicyService implements GetTenantPolicyUseCase {

    private final TenantRepository tenantRepository;
    private final ReservationProperties properties;

    @Override
    public Tenant getTenant(Long tenantId) {
        return tenantRepository.findById(tenantId)
                .orElseThrow(() -> {
                    log.warn("Tenant not found: tenantId={}", tenantId);
                    return new TenantNotFoundException(tenantId);
                });
    }

    @Override
    public BusinessHours getBusinessHours(Long tenantId) {
        TenantSettings settings = getTenant(tenantId).settings();
        var defaults = properties.appointment();

        return new BusinessHours(
                valueOrDefault(settings.businessStartHour(), defaults.businessStartHour()),
                valueOrDefault(settings.businessEndHour(), defaults.businessEndHour()),
                valueOrDefault(settings.slotIntervalMinutes(), defaults.slotIntervalMinutes()));
    }

    @Override
    public OrderPolicy getOrderPolicy(Long tenantId) {
        TenantSettings settings = getTenant(tenantId).settings();
        var defaults = properties.raffle();

        return new OrderPolicy(
                valueOrDefault(settings.minTicketsPerOrder(), defaults.minTicketsPerOrder()),
                valueOrDefault(settings.maxTicketsPerOrder(), defaults.maxTicketsPerOrder()),
                valueOrDefault(settings.reservationTimeoutMinutes(), defaults.reservationTimeoutMinutes()));
    }

    private static int valueOrDefault(Integer value, int defaultValue) {
        return value != null ? value : defaultValue;
    }
}
