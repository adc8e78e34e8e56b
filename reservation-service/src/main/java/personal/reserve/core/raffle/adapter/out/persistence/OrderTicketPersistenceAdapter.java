package personal.reserve.core.raffle.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.reserve.core.raffle.application.port.out.OrderTicketRepository;
import personal.reserve.core.raffle.domain.model.OrderTicket;

import java.util.List;

/**
 * Order Ticket Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderTicketPersistenceAdapter implements OrderTicketRepository {

    private final JpaOrderTicketRepository jpaOrderTicketRepository;

    @Override
    public void saveAll(List<OrderTicket> links) {
        jpaOrderTicketRepository.saveAll(links.stream()
                .map(OrderTicketEntity::fromDomain)
                .toList());
    }

    @Override
    public List<Integer> findTicketNumbersByOrderId(Long orderId) {
        return jpaOrderTicketRepository.findTicketNumbers(orderId);
    }

    @Override
    public void deleteByRaffle(Long raffleId) {
        int deleted = jpaOrderTicketRepository.deleteByRaffle(raffleId);
        log.debug("Order ticket links deleted: raffleId={}, count={}", raffleId, deleted);
    }
}
