package personal.reserve.core.payment.domain.model;

/**
 * 결제 대상 종류
 */
public enum PaymentTargetType {
    ORDER,
    APPOINTMENT
}
