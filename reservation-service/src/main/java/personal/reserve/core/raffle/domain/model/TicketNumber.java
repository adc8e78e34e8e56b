package personal.reserve.core.raffle.domain.model;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;

import java.time.LocalDateTime;

/**
 * Ticket Number Domain Model
 * 추첨 범위의 번호 하나 (불변)
 *
 * RESERVED: 예약 주문과 예약 만료 시각이 모두 존재
 * AVAILABLE: 둘 다 없음
 * SOLD: 만료 시각 없음, 구매 주문은 이력으로 유지
 */
public record TicketNumber(
        Long id,
        Long raffleId,
        int number,
        TicketStatus status,
        Long reservedByOrderId,
        LocalDateTime reservedUntil
) {
    public TicketNumber {
        if (raffleId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Raffle ID cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Ticket status cannot be null");
        }
        boolean holdComplete = reservedByOrderId != null && reservedUntil != null;
        if (status == TicketStatus.RESERVED && !holdComplete) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Reserved ticket %d must have an order and an expiry", number));
        }
        if (status == TicketStatus.AVAILABLE && (reservedByOrderId != null || reservedUntil != null)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Available ticket %d cannot hold a reservation", number));
        }
        if (status == TicketStatus.SOLD && reservedUntil != null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Sold ticket %d cannot have a reservation expiry", number));
        }
    }

    public static TicketNumber available(Long raffleId, int number) {
        return new TicketNumber(null, raffleId, number, TicketStatus.AVAILABLE, null, null);
    }

    public boolean isAvailable() {
        return status == TicketStatus.AVAILABLE;
    }

    /**
     * 티켓 예약 (AVAILABLE -> RESERVED)
     */
    public TicketNumber reserve(Long orderId, LocalDateTime until) {
        if (status != TicketStatus.AVAILABLE) {
            throw new IllegalStateException(
                    String.format("Cannot reserve ticket in %s status. Ticket number: %d", status, number));
        }
        return new TicketNumber(id, raffleId, number, TicketStatus.RESERVED, orderId, until);
    }

    /**
     * 예약 해제 (RESERVED -> AVAILABLE)
     */
    public TicketNumber release() {
        if (status != TicketStatus.RESERVED) {
            throw new IllegalStateException(
                    String.format("Cannot release ticket in %s status. Ticket number: %d", status, number));
        }
        return new TicketNumber(id, raffleId, number, TicketStatus.AVAILABLE, null, null);
    }

    /**
     * 판매 확정 (RESERVED -> SOLD), 예약 주문은 유지
     */
    public TicketNumber sell() {
        if (status != TicketStatus.RESERVED) {
            throw new IllegalStateException(
                    String.format("Cannot sell ticket in %s status. Ticket number: %d", status, number));
        }
        return new TicketNumber(id, raffleId, number, TicketStatus.SOLD, reservedByOrderId, null);
    }
}
