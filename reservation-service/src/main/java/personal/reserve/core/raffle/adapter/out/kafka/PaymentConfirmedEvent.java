package personal.reserve.core.raffle.adapter.out.kafka;

import personal.reserve.core.raffle.domain.model.RaffleOrder;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 결제 확정 이벤트 페이로드 (JSON)
 */
public record PaymentConfirmedEvent(
        Long orderId,
        Long raffleId,
        Long contactId,
        int quantity,
        BigDecimal totalAmount,
        String currency,
        List<Integer> ticketNumbers,
        LocalDateTime paidAt
) {
    public static PaymentConfirmedEvent of(RaffleOrder order, List<Integer> ticketNumbers) {
        return new PaymentConfirmedEvent(
                order.id(),
                order.raffleId(),
                order.contactId(),
                order.quantity(),
                order.totalAmount(),
                order.currency(),
                List.copyOf(ticketNumbers),
                order.paidAt());
    }
}
