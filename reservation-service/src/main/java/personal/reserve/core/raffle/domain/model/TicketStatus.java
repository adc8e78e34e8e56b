package personal.reserve.core.raffle.domain.model;

/**
 * Ticket Number Status
 * AVAILABLE -> RESERVED -> SOLD, RESERVED -> AVAILABLE (해제/만료)
 */
public enum TicketStatus {
    AVAILABLE,
    RESERVED,
    SOLD
}
