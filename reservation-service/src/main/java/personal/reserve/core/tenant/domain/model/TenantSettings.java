package personal.reserve.core.tenant.domain.model;

/**
 * Tenant Settings
 * 테넌트별 재정의 값 (null이면 서비스 기본값 사용)
 */
public record TenantSettings(
        Integer businessStartHour,
        Integer businessEndHour,
        Integer slotIntervalMinutes,
        Integer minTicketsPerOrder,
        Integer maxTicketsPerOrder,
        Integer reservationTimeoutMinutes
) {
    public static TenantSettings empty() {
        return new TenantSettings(null, null, null, null, null, null);
    }
}
