package personal.reserve.core.payment.domain.exception;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;
import personal.reserve.core.payment.domain.model.PaymentTarget;

/**
 * Payment Target Not Found Exception
 * 테넌트 안에 결제 대상(주문/예약)이 없을 때 발생
 */
public class PaymentTargetNotFoundException extends BusinessException {
    public PaymentTargetNotFoundException(PaymentTarget target) {
        super(ErrorCode.PAYMENT_TARGET_NOT_FOUND,
                String.format("Payment target not found: type=%s, id=%d", target.type(), target.id()));
    }
}
