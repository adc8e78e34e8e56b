package personal.reserve.core.appointment.domain.exception;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;

/**
 * Booking Exception
 * 예약(Appointment) 도메인의 비즈니스 규칙 위반 예외 상위 타입
 */
public abstract class BookingException extends BusinessException {
    protected BookingException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
