package personal.reserve.core.raffle.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.reserve.core.raffle.domain.model.OrderStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Raffle Order
 */
public interface JpaRaffleOrderRepository extends JpaRepository<RaffleOrderEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM RaffleOrderEntity o WHERE o.id = :orderId")
    Optional<RaffleOrderEntity> findForUpdate(@Param("orderId") Long orderId);

    @Query("SELECT o.raffleId FROM RaffleOrderEntity o WHERE o.id = :orderId")
    Optional<Long> findRaffleIdById(@Param("orderId") Long orderId);

    @Query("SELECT o.id FROM RaffleOrderEntity o " +
            "WHERE o.status = :status AND o.expiresAt < :now ORDER BY o.expiresAt")
    List<Long> findIdsExpiredBefore(@Param("status") OrderStatus status,
                                    @Param("now") LocalDateTime now,
                                    Pageable pageable);
}
