package personal.reserve.core.raffle.application.port.out;

import personal.reserve.core.raffle.domain.model.OrderTicket;

import java.util.List;

/**
 * Order Ticket Repository (Output Port)
 */
public interface OrderTicketRepository {

    void saveAll(List<OrderTicket> links);

    /**
     * 주문에 연결된 티켓 번호 (오름차순)
     */
    List<Integer> findTicketNumbersByOrderId(Long orderId);

    void deleteByRaffle(Long raffleId);
}
