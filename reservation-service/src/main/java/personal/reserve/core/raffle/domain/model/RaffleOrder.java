package personal.reserve.core.raffle.domain.model;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;
import personal.reserve.core.raffle.domain.exception.InvalidOrderStateException;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Raffle Order Domain Model
 * 한 연락처가 한 추첨의 티켓 qty장을 예약한 주문 (불변)
 * 금액은 생성 시점에 고정
 */
public record RaffleOrder(
        Long id,
        Long tenantId,
        Long raffleId,
        Long contactId,
        int quantity,
        BigDecimal totalAmount,
        String currency,
        OrderStatus status,
        String paymentProofId,
        LocalDateTime expiresAt,
        LocalDateTime paidAt,
        LocalDateTime createdAt
) {
    public RaffleOrder {
        if (raffleId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Raffle ID cannot be null");
        }
        if (contactId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Contact ID cannot be null");
        }
        if (quantity < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Order quantity must be at least 1");
        }
        if (totalAmount == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Total amount cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Order status cannot be null");
        }
        if (status == OrderStatus.PENDING_PAYMENT && expiresAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Pending order must have an expiration time");
        }
    }

    /**
     * 결제 대기 주문 생성 (정적 팩토리 메서드)
     *
     * @param timeoutMinutes 예약 유지 시간 (분)
     * @return 새로운 주문 (PENDING_PAYMENT, expiresAt = now + timeout)
     */
    public static RaffleOrder pendingPayment(Raffle raffle, Long contactId, int quantity,
                                             int timeoutMinutes, LocalDateTime now) {
        return new RaffleOrder(
                null,
                raffle.tenantId(),
                raffle.id(),
                contactId,
                quantity,
                raffle.priceFor(quantity),
                raffle.currency(),
                OrderStatus.PENDING_PAYMENT,
                null,
                now.plusMinutes(timeoutMinutes),
                null,
                now);
    }

    /**
     * 만료 여부 (PENDING_PAYMENT이고 now가 만료 시각 이후)
     */
    public boolean isExpired(LocalDateTime now) {
        return status == OrderStatus.PENDING_PAYMENT && now.isAfter(expiresAt);
    }

    /**
     * 주문 취소 (DRAFT/PENDING_PAYMENT/EXPIRED -> CANCELLED)
     */
    public RaffleOrder cancel() {
        if (!status.isReleasable()) {
            throw new InvalidOrderStateException(
                    String.format("Cannot release tickets for order with status: %s", status));
        }
        return withStatus(OrderStatus.CANCELLED);
    }

    /**
     * 결제 확정 (PENDING_PAYMENT -> PAID)
     */
    public RaffleOrder markPaid(String proofId, LocalDateTime now) {
        if (status != OrderStatus.PENDING_PAYMENT) {
            throw new InvalidOrderStateException(
                    String.format("Cannot confirm order with status: %s", status));
        }
        String proof = proofId != null ? proofId : paymentProofId;
        return new RaffleOrder(id, tenantId, raffleId, contactId, quantity, totalAmount, currency,
                OrderStatus.PAID, proof, expiresAt, now, createdAt);
    }

    /**
     * 주문 만료 (PENDING_PAYMENT -> EXPIRED), 만료 시각이 지난 경우에만
     */
    public RaffleOrder expire(LocalDateTime now) {
        if (!isExpired(now)) {
            throw new InvalidOrderStateException(
                    String.format("Cannot expire order with status: %s", status));
        }
        return withStatus(OrderStatus.EXPIRED);
    }

    private RaffleOrder withStatus(OrderStatus newStatus) {
        return new RaffleOrder(id, tenantId, raffleId, contactId, quantity, totalAmount, currency,
                newStatus, paymentProofId, expiresAt, paidAt, createdAt);
    }
}
