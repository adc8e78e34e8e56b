package personal.reserve.core.payment.domain.model;

/**
 * 결제 수단 제공자
 */
public enum PaymentProvider {
    BANCARD,
    MANUAL
}
