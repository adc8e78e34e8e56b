package personal.reserve.core.raffle.domain.model;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;

/**
 * Order Ticket
 * 주문이 예약한 티켓 연결 (해제 후에도 이력으로 남음)
 */
public record OrderTicket(
        Long id,
        Long orderId,
        Long ticketId
) {
    public OrderTicket {
        if (orderId == null || ticketId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Order ID and ticket ID cannot be null");
        }
    }

    public static OrderTicket link(Long orderId, Long ticketId) {
        return new OrderTicket(null, orderId, ticketId);
    }
}
