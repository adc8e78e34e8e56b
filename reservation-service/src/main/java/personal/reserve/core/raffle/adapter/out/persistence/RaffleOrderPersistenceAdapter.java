package personal.reserve.core.raffle.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import personal.reserve.core.raffle.application.port.out.OrderRepository;
import personal.reserve.core.raffle.domain.model.OrderStatus;
import personal.reserve.core.raffle.domain.model.RaffleOrder;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Raffle Order Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RaffleOrderPersistenceAdapter implements OrderRepository {

    private final JpaRaffleOrderRepository jpaRaffleOrderRepository;

    @Override
    public Optional<RaffleOrder> findById(Long orderId) {
        return jpaRaffleOrderRepository.findById(orderId)
                .map(RaffleOrderEntity::toDomain);
    }

    @Override
    public Optional<RaffleOrder> findByIdForUpdate(Long orderId) {
        log.debug("Locking order: orderId={}", orderId);
        return jpaRaffleOrderRepository.findForUpdate(orderId)
                .map(RaffleOrderEntity::toDomain);
    }

    @Override
    public Optional<Long> findRaffleIdById(Long orderId) {
        return jpaRaffleOrderRepository.findRaffleIdById(orderId);
    }

    @Override
    public List<Long> findOverduePendingIds(LocalDateTime now, int limit) {
        return jpaRaffleOrderRepository.findIdsExpiredBefore(
                OrderStatus.PENDING_PAYMENT, now, PageRequest.of(0, limit));
    }

    @Override
    public RaffleOrder save(RaffleOrder order) {
        log.debug("Saving order: orderId={}, status={}", order.id(), order.status());
        return jpaRaffleOrderRepository.save(RaffleOrderEntity.fromDomain(order)).toDomain();
    }
}
