package personal.reserve.core.raffle.application.port.in;

import personal.reserve.core.raffle.domain.model.RaffleOrder;

import java.util.List;

/**
 * Order Lifecycle UseCase (Input Port)
 */
public interface OrderLifecycleUseCase {

    RaffleOrder getOrder(Long orderId);

    /**
     * 주문에 연결된 티켓 번호 (오름차순)
     */
    List<Integer> getTicketNumbers(Long orderId);

    /**
     * 예약 해제 (DRAFT/PENDING_PAYMENT/EXPIRED -> CANCELLED)
     * 이미 CANCELLED인 주문은 아무 것도 하지 않고 0 반환
     *
     * @return 해제된 티켓 수
     */
    int releaseReservations(Long orderId);

    /**
     * 결제 확정 (PENDING_PAYMENT -> PAID), 예약 티켓을 SOLD로 변경
     * 커밋 이후 결제 확정 알림 발송 (실패해도 결과에 영향 없음)
     */
    RaffleOrder confirmPaid(Long orderId, String paymentProofId);
}
