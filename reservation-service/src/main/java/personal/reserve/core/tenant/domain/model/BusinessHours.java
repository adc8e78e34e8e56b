package personal.reserve.core.tenant.domain.model;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Business Hours
 * 예약 슬롯 생성에 사용하는 영업 시간 창과 슬롯 간격
 */
public record BusinessHours(
        int startHour,
        int endHour,
        int slotIntervalMinutes
) {
    public BusinessHours {
        if (startHour < 0 || endHour > 24 || startHour >= endHour) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Invalid business hours: start=%d, end=%d", startHour, endHour));
        }
        if (slotIntervalMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot interval must be positive");
        }
    }

    public LocalDateTime opensAt(LocalDate date) {
        return date.atStartOfDay().plusHours(startHour);
    }

    public LocalDateTime closesAt(LocalDate date) {
        return date.atStartOfDay().plusHours(endHour);
    }
}
