package personal.reserve.core.raffle.domain.exception;

import personal.reserve.common.exception.ErrorCode;

/**
 * Insufficient Tickets Exception
 * 무작위 예약 요청 수량보다 남은 티켓이 적을 때 발생
 */
public class InsufficientTicketsException extends ReservationException {
    public InsufficientTicketsException(long available, int requested) {
        super(ErrorCode.TICKETS_NOT_AVAILABLE,
                String.format("Only %d ticket(s) available, you requested %d", available, requested));
    }
}
