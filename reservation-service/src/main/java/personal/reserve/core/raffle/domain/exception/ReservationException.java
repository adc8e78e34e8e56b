package personal.reserve.core.raffle.domain.exception;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;

/**
 * Reservation Exception
 * 추첨 티켓 예약/주문 도메인의 비즈니스 규칙 위반 예외 상위 타입
 */
public abstract class ReservationException extends BusinessException {
    protected ReservationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
