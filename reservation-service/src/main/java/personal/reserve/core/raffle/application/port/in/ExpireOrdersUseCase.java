package personal.reserve.core.raffle.application.port.in;

/**
 * Expire Orders UseCase (Input Port)
 */
public interface ExpireOrdersUseCase {

    /**
     * PENDING_PAYMENT이고 만료 시각이 지났는지 여부
     */
    boolean isExpired(Long orderId);

    /**
     * 만료 처리 (PENDING_PAYMENT -> EXPIRED), 예약 티켓 해제
     *
     * @return 이번 호출로 만료되었으면 true
     */
    boolean markExpired(Long orderId);

    /**
     * 만료 시각이 지난 결제 대기 주문을 최대 batchSize건 만료 처리 (주문별 개별 트랜잭션)
     *
     * @return 만료 처리된 주문 수
     */
    int expireOverdueOrders(int batchSize);
}
