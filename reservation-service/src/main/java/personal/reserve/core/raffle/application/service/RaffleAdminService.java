package personal.reserve.core.raffle.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.reserve.core.config.ReservationProperties;
import personal.reserve.core.raffle.application.port.in.CreateRaffleCommand;
import personal.reserve.core.raffle.application.port.in.ManageRaffleUseCase;
import personal.reserve.core.raffle.application.port.out.OrderTicketRepository;
import personal.reserve.core.raffle.application.port.out.RaffleRepository;
import personal.reserve.core.raffle.application.port.out.TicketNumberRepository;
import personal.reserve.core.raffle.domain.exception.RaffleNotFoundException;
import personal.reserve.core.raffle.domain.exception.TicketsAlreadyGeneratedException;
import personal.reserve.core.raffle.domain.model.Raffle;
import personal.reserve.core.raffle.domain.model.RaffleInventory;
import personal.reserve.core.raffle.domain.model.TicketNumber;
import personal.reserve.core.raffle.domain.model.TicketStatus;
import personal.reserve.core.tenant.application.port.in.GetTenantPolicyUseCase;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Raffle Admin Service
 * 추첨 등록, 번호 티켓 생성, 재고 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RaffleAdminService implements ManageRaffleUseCase {

    private final RaffleRepository raffleRepository;
    private final TicketNumberRepository ticketNumberRepository;
    private final OrderTicketRepository orderTicketRepository;
    private final GetTenantPolicyUseCase tenantPolicy;
    private final ReservationProperties properties;
    private final Clock clock;

    @Override
    @Transactional
    public Raffle createRaffle(CreateRaffleCommand command) {
        tenantPolicy.getTenant(command.tenantId());

        Raffle raffle = new Raffle(null, command.tenantId(), command.title(), command.description(),
                command.ticketPrice(), command.currency(), true, command.minNumber(), command.maxNumber(),
                command.drawDate(), LocalDateTime.now(clock));

        Raffle saved = raffleRepository.save(raffle);
        log.info("Raffle created: raffleId={}, tenantId={}, range={}-{}",
                saved.id(), saved.tenantId(), saved.minNumber(), saved.maxNumber());
        return saved;
    }

    /**
     * 티켓 생성
     * 추첨 행을 잠가 예약과 동시에 실행되지 않도록 하고, 배치 단위로 저장
     */
    @Override
    @Transactional
    public int generateTickets(Long raffleId, boolean force) {
        Raffle raffle = raffleRepository.findByIdForUpdate(raffleId)
                .orElseThrow(RaffleNotFoundException::new);

        Map<TicketStatus, Long> counts = ticketNumberRepository.countGroupedByStatus(raffleId);
        long existing = counts.values().stream().mapToLong(Long::longValue).sum();

        if (existing > 0) {
            if (!force) {
                throw new TicketsAlreadyGeneratedException(String.format(
                        "Raffle already has %d tickets. Use force to regenerate", existing));
            }
            long held = counts.getOrDefault(TicketStatus.RESERVED, 0L) + counts.getOrDefault(TicketStatus.SOLD, 0L);
            if (held > 0) {
                throw new TicketsAlreadyGeneratedException(String.format(
                        "Cannot regenerate tickets while %d ticket(s) are reserved or sold", held));
            }
            orderTicketRepository.deleteByRaffle(raffleId);
            ticketNumberRepository.deleteByRaffle(raffleId);
            log.info("Existing tickets deleted for regeneration: raffleId={}, count={}", raffleId, existing);
        }

        int batchSize = properties.raffle().ticketGenerationBatchSize();
        List<TicketNumber> batch = new ArrayList<>(batchSize);
        int created = 0;

        // maxNumber가 Integer.MAX_VALUE여도 종료되도록 long으로 순회
        for (long number = raffle.minNumber(); number <= raffle.maxNumber(); number++) {
            batch.add(TicketNumber.available(raffleId, (int) number));
            if (batch.size() == batchSize) {
                created += ticketNumberRepository.saveAll(batch).size();
                batch.clear();
            }
        }
        if (!batch.isEmpty()) {
            created += ticketNumberRepository.saveAll(batch).size();
        }

        log.info("Tickets generated: raffleId={}, count={}", raffleId, created);
        return created;
    }

    @Override
    @Transactional(readOnly = true)
    public RaffleInventory getInventory(Long raffleId) {
        raffleRepository.findById(raffleId)
                .orElseThrow(RaffleNotFoundException::new);

        return RaffleInventory.of(raffleId, ticketNumberRepository.countGroupedByStatus(raffleId));
    }
}
