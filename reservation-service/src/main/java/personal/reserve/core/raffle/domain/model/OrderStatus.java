package personal.reserve.core.raffle.domain.model;

import java.util.Set;

/**
 * Raffle Order Status
 * DRAFT -> PENDING_PAYMENT -> PAID / CANCELLED / EXPIRED
 */
public enum OrderStatus {
    DRAFT,
    PENDING_PAYMENT,
    PAID,
    CANCELLED,
    EXPIRED;

    private static final Set<OrderStatus> RELEASABLE = Set.of(DRAFT, PENDING_PAYMENT, EXPIRED);

    /**
     * 예약 티켓 해제(취소)가 가능한 상태
     */
    public boolean isReleasable() {
        return RELEASABLE.contains(this);
    }
}
