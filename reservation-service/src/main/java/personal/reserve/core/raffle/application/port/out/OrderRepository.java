package personal.reserve.core.raffle.application.port.out;

import personal.reserve.core.raffle.domain.model.RaffleOrder;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Raffle Order Repository (Output Port)
 */
public interface OrderRepository {

    Optional<RaffleOrder> findById(Long orderId);

    Optional<RaffleOrder> findByIdForUpdate(Long orderId);

    /**
     * 주문이 속한 추첨 ID (엔티티를 로딩하지 않는 스칼라 조회)
     */
    Optional<Long> findRaffleIdById(Long orderId);

    /**
     * 만료 시각이 지난 PENDING_PAYMENT 주문 ID (만료 시각 오름차순, 최대 limit건)
     */
    List<Long> findOverduePendingIds(LocalDateTime now, int limit);

    RaffleOrder save(RaffleOrder order);
}
