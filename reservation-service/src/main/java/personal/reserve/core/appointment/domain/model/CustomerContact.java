package personal.reserve.core.appointment.domain.model;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;

/**
 * 예약 요청에 포함된 고객 연락처
 * 길이 제한은 customers 테이블 컬럼 길이와 일치
 */
public record CustomerContact(
        String name,
        String phone,
        String email
) {
    public static final int MAX_PHONE_LENGTH = 30;
    public static final int MAX_TEXT_LENGTH = 255;

    public CustomerContact {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer name cannot be null or blank");
        }
        if (name.length() > MAX_TEXT_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Customer name must be at most %d characters", MAX_TEXT_LENGTH));
        }
        if (phone == null || phone.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer phone cannot be null or blank");
        }
        if (phone.length() > MAX_PHONE_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Customer phone must be at most %d characters", MAX_PHONE_LENGTH));
        }
        if (email != null && email.isBlank()) {
            email = null;
        }
        if (email != null && email.length() > MAX_TEXT_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Customer email must be at most %d characters", MAX_TEXT_LENGTH));
        }
    }
}
