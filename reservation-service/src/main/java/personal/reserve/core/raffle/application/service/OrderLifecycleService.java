package personal.reserve.core.raffle.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.reserve.core.raffle.application.port.in.OrderLifecycleUseCase;
import personal.reserve.core.raffle.application.port.out.OrderRepository;
import personal.reserve.core.raffle.application.port.out.OrderTicketRepository;
import personal.reserve.core.raffle.application.port.out.PaymentNotificationPort;
import personal.reserve.core.raffle.domain.exception.OrderNotFoundException;
import personal.reserve.core.raffle.domain.model.RaffleOrder;
import personal.reserve.core.raffle.domain.service.OrderLifecycleManager;
import personal.reserve.core.support.StoreFailures;

import java.util.List;

/**
 * Order Lifecycle Service
 * 주문 해제 / 결제 확정 진입점
 * 결제 확정 알림은 트랜잭션 커밋 이후 발송 (실패는 로그만 남기고 전파하지 않음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderLifecycleService implements OrderLifecycleUseCase {

    private final OrderLifecycleManager lifecycleManager;
    private final OrderRepository orderRepository;
    private final OrderTicketRepository orderTicketRepository;
    private final PaymentNotificationPort paymentNotificationPort;

    @Override
    public RaffleOrder getOrder(Long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found: orderId={}", orderId);
                    return new OrderNotFoundException(orderId);
                });
    }

    @Override
    public List<Integer> getTicketNumbers(Long orderId) {
        getOrder(orderId);
        return orderTicketRepository.findTicketNumbersByOrderId(orderId);
    }

    @Override
    public int releaseReservations(Long orderId) {
        return StoreFailures.translate("releaseReservations", () -> lifecycleManager.releaseReservations(orderId));
    }

    @Override
    public RaffleOrder confirmPaid(Long orderId, String paymentProofId) {
        RaffleOrder paid = StoreFailures.translate("confirmPaid",
                () -> lifecycleManager.confirmPaid(orderId, paymentProofId));

        try {
            paymentNotificationPort.notifyPaymentConfirmed(paid, orderTicketRepository.findTicketNumbersByOrderId(orderId));
        } catch (Exception e) {
            log.error("Failed to send payment confirmation: orderId={}", orderId, e);
        }
        return paid;
    }
}
