package personal.reserve.core.raffle.domain.exception;

import personal.reserve.common.exception.ErrorCode;

/**
 * Concurrent Reservation Exception
 * 무작위로 고른 티켓을 잠근 시점에 이미 다른 주문에 예약된 경우
 */
public class ConcurrentReservationException extends ReservationException {
    public ConcurrentReservationException(Long raffleId) {
        super(ErrorCode.CONCURRENT_RESERVATION,
                String.format("Tickets were taken by a concurrent reservation: raffleId=%d", raffleId));
    }
}
