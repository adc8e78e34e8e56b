package personal.reserve.core.raffle.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.hibernate.jpa.HibernateHints;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import personal.reserve.core.raffle.domain.model.TicketStatus;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

/**
 * Spring Data JPA Repository for TicketNumber
 * 잠금 조회는 번호 오름차순
 */
public interface JpaTicketNumberRepository extends JpaRepository<TicketNumberEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TicketNumberEntity t " +
            "WHERE t.raffleId = :raffleId AND t.number IN :numbers ORDER BY t.number")
    List<TicketNumberEntity> findByNumbersForUpdate(@Param("raffleId") Long raffleId,
                                                    @Param("numbers") Collection<Integer> numbers);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TicketNumberEntity t WHERE t.id IN :ids ORDER BY t.number")
    List<TicketNumberEntity> findByIdsForUpdate(@Param("ids") Collection<Long> ids);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TicketNumberEntity t " +
            "WHERE t.reservedByOrderId = :orderId AND t.status = :status ORDER BY t.number")
    List<TicketNumberEntity> findByOrderAndStatusForUpdate(@Param("orderId") Long orderId,
                                                           @Param("status") TicketStatus status);

    long countByRaffleIdAndStatus(Long raffleId, TicketStatus status);

    @Query("SELECT t.status, COUNT(t) FROM TicketNumberEntity t WHERE t.raffleId = :raffleId GROUP BY t.status")
    List<Object[]> countGroupedByStatus(@Param("raffleId") Long raffleId);

    @QueryHints(@QueryHint(name = HibernateHints.HINT_FETCH_SIZE, value = "500"))
    @Query("SELECT t.id FROM TicketNumberEntity t WHERE t.raffleId = :raffleId AND t.status = :status")
    Stream<Long> streamIds(@Param("raffleId") Long raffleId, @Param("status") TicketStatus status);

    /**
     * 만료된 예약 해제
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE TicketNumberEntity t " +
            "SET t.status = :available, t.reservedByOrderId = null, t.reservedUntil = null " +
            "WHERE t.raffleId = :raffleId AND t.status = :reserved AND t.reservedUntil < :now")
    int releaseExpired(@Param("raffleId") Long raffleId,
                       @Param("now") LocalDateTime now,
                       @Param("reserved") TicketStatus reserved,
                       @Param("available") TicketStatus available);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE TicketNumberEntity t SET t.status = :sold, t.reservedUntil = null " +
            "WHERE t.reservedByOrderId = :orderId AND t.status = :reserved")
    int markSoldByOrder(@Param("orderId") Long orderId,
                        @Param("reserved") TicketStatus reserved,
                        @Param("sold") TicketStatus sold);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE TicketNumberEntity t " +
            "SET t.status = :available, t.reservedByOrderId = null, t.reservedUntil = null " +
            "WHERE t.reservedByOrderId = :orderId AND t.status = :reserved")
    int releaseByOrder(@Param("orderId") Long orderId,
                       @Param("reserved") TicketStatus reserved,
                       @Param("available") TicketStatus available);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM TicketNumberEntity t WHERE t.raffleId = :raffleId")
    int deleteByRaffle(@Param("raffleId") Long raffleId);
}
