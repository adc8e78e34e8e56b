package personal.reserve.core.appointment.domain.exception;

import personal.reserve.common.exception.ErrorCode;

/**
 * Appointment Not Found Exception
 */
public class AppointmentNotFoundException extends BookingException {
    public AppointmentNotFoundException(Long appointmentId) {
        super(ErrorCode.APPOINTMENT_NOT_FOUND, String.format("Appointment not found: appointmentId=%d", appointmentId));
    }
}
