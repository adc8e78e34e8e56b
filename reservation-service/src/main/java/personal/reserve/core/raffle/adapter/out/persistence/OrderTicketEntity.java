package personal.reserve.core.raffle.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.reserve.core.raffle.domain.model.OrderTicket;

/**
 * Order Ticket JPA Entity
 * (order_id, ticket_id) 유니크
 */
@Entity
@Table(name = "order_tickets",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_order_ticket",
                columnNames = {"order_id", "ticket_id"}
        ),
        indexes = @Index(name = "idx_order_ticket_ticket", columnList = "ticket_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderTicketEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "ticket_id", nullable = false)
    private Long ticketId;

    public static OrderTicketEntity fromDomain(OrderTicket link) {
        OrderTicketEntity entity = new OrderTicketEntity();
        entity.id = link.id();
        entity.orderId = link.orderId();
        entity.ticketId = link.ticketId();
        return entity;
    }
}
