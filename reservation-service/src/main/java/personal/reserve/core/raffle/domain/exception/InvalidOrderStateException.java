package personal.reserve.core.raffle.domain.exception;

import personal.reserve.common.exception.ErrorCode;

/**
 * Invalid Order State Exception
 * 현재 주문 상태에서 허용되지 않는 전이
 */
public class InvalidOrderStateException extends ReservationException {
    public InvalidOrderStateException(String message) {
        super(ErrorCode.INVALID_STATE_TRANSITION, message);
    }
}
