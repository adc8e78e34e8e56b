package personal.reserve.core.tenant.domain.model;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;

/**
 * Order Policy
 * 주문당 티켓 수량 한도와 예약 유지 시간
 */
public record OrderPolicy(
        int minTicketsPerOrder,
        int maxTicketsPerOrder,
        int reservationTimeoutMinutes
) {
    public OrderPolicy {
        if (minTicketsPerOrder < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Minimum tickets per order must be at least 1");
        }
        if (maxTicketsPerOrder < minTicketsPerOrder) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Maximum tickets per order must be greater than or equal to the minimum");
        }
        if (reservationTimeoutMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation timeout must be positive");
        }
    }
}
