package personal.reserve.core.payment.application.port.out;

import personal.reserve.core.payment.domain.model.PaymentTarget;

/**
 * Payment Target Validation Port (Output Port)
 * 결제 대상이 테넌트 안에 존재하는지 확인
 */
public interface PaymentTargetValidationPort {

    boolean exists(Long tenantId, PaymentTarget target);
}
