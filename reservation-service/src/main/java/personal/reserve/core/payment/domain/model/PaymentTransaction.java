package personal.reserve.core.payment.domain.model;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Payment Transaction Domain Model
 * 외부 결제 제공자의 거래 기록 (불변)
 */
public record PaymentTransaction(
        Long id,
        Long tenantId,
        PaymentProvider provider,
        String externalId,
        BigDecimal amount,
        String currency,
        PaymentTransactionStatus status,
        PaymentTarget target,
        String notes,
        LocalDateTime createdAt,
        LocalDateTime confirmedAt
) {
    public PaymentTransaction {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (provider == null || status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Payment provider and status cannot be null");
        }
        if (externalId == null || externalId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "External ID cannot be null or blank");
        }
        if (amount == null || amount.signum() < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Payment amount cannot be negative");
        }
        if (target == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Payment target cannot be null");
        }
    }

    /**
     * 거래 기록 생성 (PAID 상태면 확인 시각 기록)
     */
    public static PaymentTransaction record(Long tenantId, PaymentProvider provider, String externalId,
                                            BigDecimal amount, String currency, PaymentTransactionStatus status,
                                            PaymentTarget target, String notes, LocalDateTime now) {
        LocalDateTime confirmedAt = status == PaymentTransactionStatus.PAID ? now : null;
        return new PaymentTransaction(null, tenantId, provider, externalId, amount, currency, status,
                target, notes, now, confirmedAt);
    }
}
