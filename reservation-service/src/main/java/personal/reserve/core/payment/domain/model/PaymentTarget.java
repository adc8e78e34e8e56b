package personal.reserve.core.payment.domain.model;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;

/**
 * Payment Target
 * 결제 거래가 가리키는 대상 (추첨 주문 또는 예약 중 정확히 하나)
 */
public record PaymentTarget(
        PaymentTargetType type,
        Long id
) {
    public PaymentTarget {
        if (type == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Payment target type cannot be null");
        }
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Payment target ID cannot be null");
        }
    }

    public static PaymentTarget order(Long orderId) {
        return new PaymentTarget(PaymentTargetType.ORDER, orderId);
    }

    public static PaymentTarget appointment(Long appointmentId) {
        return new PaymentTarget(PaymentTargetType.APPOINTMENT, appointmentId);
    }

    /**
     * 두 개의 nullable 참조 컬럼에서 복원 (정확히 하나만 값이 있어야 함)
     */
    public static PaymentTarget fromColumns(Long orderId, Long appointmentId) {
        if ((orderId == null) == (appointmentId == null)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Payment transaction must reference exactly one of order or appointment");
        }
        return orderId != null ? order(orderId) : appointment(appointmentId);
    }

    public Long orderId() {
        return type == PaymentTargetType.ORDER ? id : null;
    }

    public Long appointmentId() {
        return type == PaymentTargetType.APPOINTMENT ? id : null;
    }
}
