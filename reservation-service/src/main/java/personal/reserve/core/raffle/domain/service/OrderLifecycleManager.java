package personal.reserve.core.raffle.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.reserve.core.raffle.application.port.out.OrderRepository;
import personal.reserve.core.raffle.application.port.out.RaffleRepository;
import personal.reserve.core.raffle.application.port.out.TicketNumberRepository;
import personal.reserve.core.raffle.domain.exception.NoReservedTicketsException;
import personal.reserve.core.raffle.domain.exception.OrderNotFoundException;
import personal.reserve.core.raffle.domain.model.OrderStatus;
import personal.reserve.core.raffle.domain.model.RaffleOrder;
import personal.reserve.core.raffle.domain.model.TicketNumber;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Order Lifecycle Domain Service (Transaction Manager)
 * 주문 해제 / 결제 확정 / 만료를 각각 하나의 트랜잭션으로 실행
 * 락 순서: 추첨 행 -> 주문 행 -> 티켓 행 (예약 경로와 같은 부모 우선 순서)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderLifecycleManager {

    private final RaffleRepository raffleRepository;
    private final OrderRepository orderRepository;
    private final TicketNumberRepository ticketNumberRepository;
    private final OrderTransitionEffects transitionEffects;
    private final Clock clock;

    /**
     * 예약 해제 (DRAFT/PENDING_PAYMENT/EXPIRED -> CANCELLED)
     *
     * @return 해제된 티켓 수 (이미 CANCELLED이면 0)
     */
    @Transactional
    public int releaseReservations(Long orderId) {
        RaffleOrder order = lockOrder(orderId);

        if (order.status() == OrderStatus.CANCELLED) {
            log.debug("Order already cancelled: orderId={}", orderId);
            return 0;
        }

        RaffleOrder cancelled = orderRepository.save(order.cancel());
        int released = transitionEffects.apply(order, cancelled);

        log.info("Order reservations released: orderId={}, tickets={}", orderId, released);
        return released;
    }

    /**
     * 결제 확정 (PENDING_PAYMENT -> PAID)
     * 주문이 예약 중인 티켓을 SOLD로 변경 (예약 주문 ID는 유지, 만료 시각 제거)
     */
    @Transactional
    public RaffleOrder confirmPaid(Long orderId, String paymentProofId) {
        LocalDateTime now = LocalDateTime.now(clock);
        RaffleOrder order = lockOrder(orderId);
        RaffleOrder paid = order.markPaid(paymentProofId, now);

        List<TicketNumber> reserved = ticketNumberRepository.findReservedByOrderForUpdate(orderId);
        if (reserved.isEmpty()) {
            log.warn("No reserved tickets for order: orderId={}", orderId);
            throw new NoReservedTicketsException();
        }
        ticketNumberRepository.saveAll(reserved.stream().map(TicketNumber::sell).toList());

        RaffleOrder saved = orderRepository.save(paid);
        transitionEffects.apply(order, saved);

        log.info("Order confirmed paid: orderId={}, tickets={}, proofId={}", orderId, reserved.size(), paymentProofId);
        return saved;
    }

    /**
     * 만료 처리 (PENDING_PAYMENT && now > expiresAt -> EXPIRED)
     * 만료 대상이 아니면 아무 것도 하지 않음 (스케줄러와 명시적 해제가 겹쳐도 안전)
     *
     * @return 이번 호출로 만료되었으면 true
     */
    @Transactional
    public boolean markExpired(Long orderId) {
        LocalDateTime now = LocalDateTime.now(clock);
        RaffleOrder order = lockOrder(orderId);

        if (!order.isExpired(now)) {
            log.debug("Order not expirable: orderId={}, status={}", orderId, order.status());
            return false;
        }

        RaffleOrder expired = orderRepository.save(order.expire(now));
        int released = transitionEffects.apply(order, expired);

        log.info("Order expired: orderId={}, ticketsReleased={}", orderId, released);
        return true;
    }

    /**
     * 추첨 행을 먼저 잠근 뒤 주문 행을 잠금
     * 락 이전에는 주문 엔티티를 읽지 않음 (영속성 컨텍스트에 이전 상태가 남지 않도록)
     */
    private RaffleOrder lockOrder(Long orderId) {
        Long raffleId = orderRepository.findRaffleIdById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        raffleRepository.findByIdForUpdate(raffleId);

        return orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
