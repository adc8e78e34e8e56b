package personal.reserve.core.raffle.application.port.out;

import personal.reserve.core.raffle.domain.model.RaffleOrder;

import java.util.List;

/**
 * Payment Notification Port (Output Port)
 * 결제 확정 알림 발송 (best-effort)
 */
public interface PaymentNotificationPort {

    void notifyPaymentConfirmed(RaffleOrder order, List<Integer> ticketNumbers);
}
