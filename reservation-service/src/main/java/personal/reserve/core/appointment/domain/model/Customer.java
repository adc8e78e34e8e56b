package personal.reserve.core.appointment.domain.model;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Customer Domain Model
 * 테넌트 내에서 전화번호로 식별되는 고객 (불변)
 */
public record Customer(
        Long id,
        Long tenantId,
        String name,
        String phone,
        String email,
        LocalDateTime lastAppointmentAt
) {
    public Customer {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (phone == null || phone.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer phone cannot be null or blank");
        }
    }

    public static Customer create(Long tenantId, CustomerContact contact) {
        return new Customer(null, tenantId, contact.name(), contact.phone(), contact.email(), null);
    }

    /**
     * 연락처 갱신
     * 이름이 바뀐 경우에만 이름과 (제공된 경우) 이메일을 갱신
     */
    public Customer withContact(CustomerContact contact) {
        if (Objects.equals(name, contact.name())) {
            return this;
        }
        String newEmail = contact.email() != null ? contact.email() : email;
        return new Customer(id, tenantId, contact.name(), phone, newEmail, lastAppointmentAt);
    }

    public Customer recordAppointment(LocalDateTime at) {
        return new Customer(id, tenantId, name, phone, email, at);
    }
}
