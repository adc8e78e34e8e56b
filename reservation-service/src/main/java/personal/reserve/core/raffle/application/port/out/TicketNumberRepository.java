package personal.reserve.core.raffle.application.port.out;

import personal.reserve.core.raffle.domain.model.TicketNumber;
import personal.reserve.core.raffle.domain.model.TicketStatus;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Ticket Number Repository (Output Port)
 * 잠금 조회는 항상 번호 오름차순 (락 순서 역전에 의한 데드락 방지)
 */
public interface TicketNumberRepository {

    /**
     * 만료된 예약 일괄 해제 (RESERVED && reservedUntil < now -> AVAILABLE)
     *
     * @return 해제된 티켓 수
     */
    int releaseExpired(Long raffleId, LocalDateTime now);

    List<TicketNumber> findByNumbersForUpdate(Long raffleId, Collection<Integer> numbers);

    List<TicketNumber> findByIdsForUpdate(Collection<Long> ticketIds);

    /**
     * 주문이 예약 중인(RESERVED) 티켓 잠금 조회
     */
    List<TicketNumber> findReservedByOrderForUpdate(Long orderId);

    long countByStatus(Long raffleId, TicketStatus status);

    Map<TicketStatus, Long> countGroupedByStatus(Long raffleId);

    /**
     * AVAILABLE 티켓 ID 스트림 (호출자가 트랜잭션 안에서 닫아야 함)
     */
    Stream<Long> streamAvailableIds(Long raffleId);

    /**
     * 주문이 예약 중인 티켓을 SOLD로 변경 (이미 SOLD이면 변경 없음)
     */
    int markSoldByOrder(Long orderId);

    /**
     * 주문이 예약 중인 티켓을 AVAILABLE로 변경 (이미 해제되었으면 변경 없음)
     */
    int releaseByOrder(Long orderId);

    List<TicketNumber> saveAll(List<TicketNumber> tickets);

    void deleteByRaffle(Long raffleId);
}
