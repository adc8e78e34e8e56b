package personal.reserve.core.raffle.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.reserve.core.raffle.application.port.out.TicketNumberRepository;
import personal.reserve.core.raffle.domain.model.TicketNumber;
import personal.reserve.core.raffle.domain.model.TicketStatus;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Ticket Number Persistence Adapter
 * JPA를 사용한 티켓 번호 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TicketNumberPersistenceAdapter implements TicketNumberRepository {

    private final JpaTicketNumberRepository jpaTicketNumberRepository;

    @Override
    public int releaseExpired(Long raffleId, LocalDateTime now) {
        return jpaTicketNumberRepository.releaseExpired(raffleId, now, TicketStatus.RESERVED, TicketStatus.AVAILABLE);
    }

    @Override
    public List<TicketNumber> findByNumbersForUpdate(Long raffleId, Collection<Integer> numbers) {
        log.debug("Locking tickets by number: raffleId={}, count={}", raffleId, numbers.size());
        return toDomain(jpaTicketNumberRepository.findByNumbersForUpdate(raffleId, numbers));
    }

    @Override
    public List<TicketNumber> findByIdsForUpdate(Collection<Long> ticketIds) {
        if (ticketIds.isEmpty()) {
            return List.of();
        }
        log.debug("Locking tickets by id: count={}", ticketIds.size());
        return toDomain(jpaTicketNumberRepository.findByIdsForUpdate(ticketIds));
    }

    @Override
    public List<TicketNumber> findReservedByOrderForUpdate(Long orderId) {
        return toDomain(jpaTicketNumberRepository.findByOrderAndStatusForUpdate(orderId, TicketStatus.RESERVED));
    }

    @Override
    public long countByStatus(Long raffleId, TicketStatus status) {
        return jpaTicketNumberRepository.countByRaffleIdAndStatus(raffleId, status);
    }

    @Override
    public Map<TicketStatus, Long> countGroupedByStatus(Long raffleId) {
        Map<TicketStatus, Long> counts = new EnumMap<>(TicketStatus.class);
        for (Object[] row : jpaTicketNumberRepository.countGroupedByStatus(raffleId)) {
            counts.put((TicketStatus) row[0], (Long) row[1]);
        }
        return counts;
    }

    @Override
    public Stream<Long> streamAvailableIds(Long raffleId) {
        return jpaTicketNumberRepository.streamIds(raffleId, TicketStatus.AVAILABLE);
    }

    @Override
    public int markSoldByOrder(Long orderId) {
        return jpaTicketNumberRepository.markSoldByOrder(orderId, TicketStatus.RESERVED, TicketStatus.SOLD);
    }

    @Override
    public int releaseByOrder(Long orderId) {
        return jpaTicketNumberRepository.releaseByOrder(orderId, TicketStatus.RESERVED, TicketStatus.AVAILABLE);
    }

    @Override
    public List<TicketNumber> saveAll(List<TicketNumber> tickets) {
        List<TicketNumberEntity> entities = tickets.stream()
                .map(TicketNumberEntity::fromDomain)
                .toList();
        return toDomain(jpaTicketNumberRepository.saveAll(entities));
    }

    @Override
    public void deleteByRaffle(Long raffleId) {
        int deleted = jpaTicketNumberRepository.deleteByRaffle(raffleId);
        log.debug("Tickets deleted: raffleId={}, count={}", raffleId, deleted);
    }

    private static List<TicketNumber> toDomain(List<TicketNumberEntity> entities) {
        return entities.stream()
                .map(TicketNumberEntity::toDomain)
                .toList();
    }
}
