package personal.reserve.core.appointment.domain.exception;

import personal.reserve.common.exception.ErrorCode;

/**
 * Service Not Found Exception
 * 서비스가 없거나 비활성 상태일 때 발생
 */
public class ServiceNotFoundException extends BookingException {
    public ServiceNotFoundException(Long serviceId) {
        super(ErrorCode.SERVICE_NOT_FOUND, "Service not found or inactive");
    }
}
