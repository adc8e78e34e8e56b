package personal.reserve.core.appointment.domain.exception;

import personal.reserve.common.exception.ErrorCode;

/**
 * Invalid Booking Time Exception
 * 과거 시각이거나 사전 예약 가능 기간을 넘는 예약 요청
 */
public class InvalidBookingTimeException extends BookingException {
    public InvalidBookingTimeException(String message) {
        super(ErrorCode.INVALID_TIME_WINDOW, message);
    }
}
