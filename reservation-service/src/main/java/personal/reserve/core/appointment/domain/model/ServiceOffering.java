package personal.reserve.core.appointment.domain.model;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;
import personal.reserve.core.appointment.domain.exception.InvalidBookingTimeException;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Service Offering Domain Model
 * 예약 가능한 서비스 (소요 시간, 가격, 버퍼, 일일 한도, 사전 예약 가능 일수)
 */
public record ServiceOffering(
        Long id,
        Long tenantId,
        String name,
        int durationMinutes,
        BigDecimal price,
        String currency,
        int bufferTimeMinutes,
        int maxBookingsPerDay,
        int advanceBookingDays,
        boolean active
) {
    public static final int MIN_DURATION_MINUTES = 5;

    public ServiceOffering {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service name cannot be null or blank");
        }
        if (durationMinutes < MIN_DURATION_MINUTES) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Service duration must be at least %d minutes", MIN_DURATION_MINUTES));
        }
        if (price == null || price.signum() < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service price cannot be negative");
        }
        if (currency == null || currency.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Currency cannot be null or blank");
        }
        if (bufferTimeMinutes < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Buffer time cannot be negative");
        }
        if (maxBookingsPerDay < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Max bookings per day must be at least 1");
        }
        if (advanceBookingDays < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Advance booking days must be at least 1");
        }
    }

    /**
     * 충돌 검사 범위 (분)
     * 후보 시각 기준 앞뒤로 서비스 소요 시간 + 버퍼 안에 시작하는 활성 예약은 충돌
     */
    public int conflictReachMinutes() {
        return durationMinutes + bufferTimeMinutes;
    }

    /**
     * 예약 시각 검증
     * 현재 이후여야 하고 사전 예약 가능 일수를 넘을 수 없음
     *
     * @throws InvalidBookingTimeException 과거 시각이거나 예약 가능 기간을 넘을 때
     */
    public void ensureBookableAt(LocalDateTime scheduledAt, LocalDateTime now) {
        if (!scheduledAt.isAfter(now)) {
            throw new InvalidBookingTimeException("Cannot book appointments in the past");
        }
        if (scheduledAt.isAfter(now.plusDays(advanceBookingDays))) {
            throw new InvalidBookingTimeException(
                    String.format("Cannot book more than %d days in advance", advanceBookingDays));
        }
    }
}
