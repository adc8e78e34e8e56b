package personal.reserve.core.payment.application.port.in;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;
import personal.reserve.core.payment.domain.model.PaymentProvider;
import personal.reserve.core.payment.domain.model.PaymentTarget;
import personal.reserve.core.payment.domain.model.PaymentTransactionStatus;

import java.math.BigDecimal;

/**
 * Record Payment Transaction Command
 */
public record RecordPaymentTransactionCommand(
        Long tenantId,
        PaymentProvider provider,
        String externalId,
        BigDecimal amount,
        String currency,
        PaymentTransactionStatus status,
        PaymentTarget target,
        String notes
) {
    public RecordPaymentTransactionCommand {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (target == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Payment target cannot be null");
        }
        if (provider == null) {
            provider = PaymentProvider.MANUAL;
        }
        if (currency == null || currency.isBlank()) {
            currency = "USD";
        }
        if (status == null) {
            status = PaymentTransactionStatus.PENDING;
        }
    }
}
