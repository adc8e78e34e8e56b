package personal.reserve.core.raffle.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.reserve.core.raffle.application.port.out.TicketNumberRepository;
import personal.reserve.core.raffle.domain.model.OrderStatus;
import personal.reserve.core.raffle.domain.model.RaffleOrder;

/**
 * Order Transition Effects
 * 주문 상태가 바뀔 때 티켓 상태를 맞추는 후처리 (호출자의 트랜잭션 안에서 실행)
 * PAID -> 예약 티켓 SOLD, CANCELLED/EXPIRED -> 예약 티켓 AVAILABLE
 * 상태 조건부 일괄 UPDATE라 이미 반영된 경우 0건으로 끝남
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderTransitionEffects {

    private final TicketNumberRepository ticketNumberRepository;

    /**
     * @return 상태가 바뀐 티켓 수
     */
    public int apply(RaffleOrder before, RaffleOrder after) {
        if (before.status() == after.status()) {
            return 0;
        }

        OrderStatus status = after.status();
        if (status == OrderStatus.PAID) {
            int sold = ticketNumberRepository.markSoldByOrder(after.id());
            log.info("Order paid, tickets sold: orderId={}, previous={}, tickets={}", after.id(), before.status(), sold);
            return sold;
        }
        if (status == OrderStatus.CANCELLED || status == OrderStatus.EXPIRED) {
            int released = ticketNumberRepository.releaseByOrder(after.id());
            log.info("Order {}, tickets released: orderId={}, previous={}, tickets={}",
                    status, after.id(), before.status(), released);
            return released;
        }
        return 0;
    }
}
