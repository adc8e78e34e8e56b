package personal.reserve.core.raffle.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Spring Data JPA Repository for Order Ticket
 */
public interface JpaOrderTicketRepository extends JpaRepository<OrderTicketEntity, Long> {

    @Query("SELECT t.number FROM OrderTicketEntity ot, TicketNumberEntity t " +
            "WHERE ot.ticketId = t.id AND ot.orderId = :orderId ORDER BY t.number")
    List<Integer> findTicketNumbers(@Param("orderId") Long orderId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM OrderTicketEntity ot WHERE ot.ticketId IN " +
            "(SELECT t.id FROM TicketNumberEntity t WHERE t.raffleId = :raffleId)")
    int deleteByRaffle(@Param("raffleId") Long raffleId);
}
