package personal.reserve.core.payment.domain.model;

/**
 * 결제 거래 상태
 */
public enum PaymentTransactionStatus {
    PENDING,
    PAID,
    FAILED,
    REFUNDED
}
