package personal.reserve.core.appointment.domain.exception;

import personal.reserve.common.exception.ErrorCode;

/**
 * Invalid Appointment State Exception
 * 현재 상태에서 허용되지 않는 예약 상태 전이
 */
public class InvalidAppointmentStateException extends BookingException {
    public InvalidAppointmentStateException(String message) {
        super(ErrorCode.INVALID_STATE_TRANSITION, message);
    }
}
