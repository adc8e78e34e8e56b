package personal.reserve.core.appointment.application.port.in;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;
import personal.reserve.core.appointment.domain.model.CustomerContact;

import java.time.LocalDateTime;

/**
 * Create Appointment Command
 * 예약 생성 커맨드
 */
public record CreateAppointmentCommand(
        Long tenantId,
        Long serviceId,
        CustomerContact customer,
        LocalDateTime scheduledAt,
        String notes
) {
    public CreateAppointmentCommand {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (serviceId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service ID cannot be null");
        }
        if (customer == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer contact cannot be null");
        }
        if (scheduledAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Scheduled time cannot be null");
        }
        if (notes == null) {
            notes = "";
        }
    }
}
