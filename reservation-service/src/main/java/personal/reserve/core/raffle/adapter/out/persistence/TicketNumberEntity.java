package personal.reserve.core.raffle.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.reserve.core.raffle.domain.model.TicketNumber;
import personal.reserve.core.raffle.domain.model.TicketStatus;

import java.time.LocalDateTime;

/**
 * Ticket Number JPA Entity
 * (raffle_id, ticket_number) 유니크
 */
@Entity
@Table(name = "ticket_numbers",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_raffle_ticket_number",
                columnNames = {"raffle_id", "ticket_number"}
        ),
        indexes = {
                @Index(name = "idx_ticket_raffle_status", columnList = "raffle_id, status"),
                @Index(name = "idx_ticket_status_reserved_until", columnList = "status, reserved_until"),
                @Index(name = "idx_ticket_reserved_order", columnList = "reserved_by_order_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TicketNumberEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "raffle_id", nullable = false)
    private Long raffleId;

    @Column(name = "ticket_number", nullable = false)
    private int number;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TicketStatus status;

    @Column(name = "reserved_by_order_id")
    private Long reservedByOrderId;

    @Column(name = "reserved_until")
    private LocalDateTime reservedUntil;

    public static TicketNumberEntity fromDomain(TicketNumber ticket) {
        TicketNumberEntity entity = new TicketNumberEntity();
        entity.id = ticket.id();
        entity.raffleId = ticket.raffleId();
        entity.number = ticket.number();
        entity.status = ticket.status();
        entity.reservedByOrderId = ticket.reservedByOrderId();
        entity.reservedUntil = ticket.reservedUntil();
        return entity;
    }

    public TicketNumber toDomain() {
        return new TicketNumber(id, raffleId, number, status, reservedByOrderId, reservedUntil);
    }
}
