package personal.reserve.core.raffle.domain.model;

import java.util.Map;

/**
 * 추첨 티켓 재고 현황
 */
public record RaffleInventory(
        Long raffleId,
        long total,
        long available,
        long reserved,
        long sold
) {
    public static RaffleInventory of(Long raffleId, Map<TicketStatus, Long> counts) {
        long available = counts.getOrDefault(TicketStatus.AVAILABLE, 0L);
        long reserved = counts.getOrDefault(TicketStatus.RESERVED, 0L);
        long sold = counts.getOrDefault(TicketStatus.SOLD, 0L);
        return new RaffleInventory(raffleId, available + reserved + sold, available, reserved, sold);
    }
}
