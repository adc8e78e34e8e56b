package personal.reserve.core.raffle.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.reserve.core.raffle.application.port.in.ReserveRandomTicketsCommand;
import personal.reserve.core.raffle.application.port.in.ReserveSpecificTicketsCommand;
import personal.reserve.core.raffle.application.port.out.OrderRepository;
import personal.reserve.core.raffle.application.port.out.OrderTicketRepository;
import personal.reserve.core.raffle.application.port.out.RaffleRepository;
import personal.reserve.core.raffle.application.port.out.RandomSource;
import personal.reserve.core.raffle.application.port.out.TicketNumberRepository;
import personal.reserve.core.raffle.domain.exception.ConcurrentReservationException;
import personal.reserve.core.raffle.domain.exception.InsufficientTicketsException;
import personal.reserve.core.raffle.domain.exception.InvalidTicketNumbersException;
import personal.reserve.core.raffle.domain.exception.RaffleNotFoundException;
import personal.reserve.core.raffle.domain.exception.TicketsNotAvailableException;
import personal.reserve.core.raffle.domain.model.OrderTicket;
import personal.reserve.core.raffle.domain.model.Raffle;
import personal.reserve.core.raffle.domain.model.RaffleOrder;
import personal.reserve.core.raffle.domain.model.TicketNumber;
import personal.reserve.core.raffle.domain.model.TicketStatus;
import personal.reserve.core.tenant.application.port.in.GetTenantPolicyUseCase;
import personal.reserve.core.tenant.domain.model.OrderPolicy;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Ticket Reservation Domain Service (Transaction Manager)
 * 지정/무작위 예약을 하나의 트랜잭션으로 실행
 * 락 순서: 추첨 행 -> 티켓 행 (번호 오름차순)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TicketReservationManager {

    private final RaffleRepository raffleRepository;
    private final TicketNumberRepository ticketNumberRepository;
    private final OrderRepository orderRepository;
    private final OrderTicketRepository orderTicketRepository;
    private final GetTenantPolicyUseCase tenantPolicy;
    private final TicketRequestValidator validator;
    private final RandomSource randomSource;
    private final Clock clock;

    /**
     * 지정 번호 예약
     * 1. 추첨 행 잠금 (활성 추첨만)
     * 2. 수량, 범위, 중복 검증
     * 3. 만료된 예약 해제 (lazy sweep)
     * 4. 요청 번호 잠금 후 존재/가용 여부 확인
     * 5. 주문 생성 + 티켓 예약 + 주문-티켓 연결
     */
    @Transactional
    public RaffleOrder reserveSpecific(ReserveSpecificTicketsCommand command) {
        LocalDateTime now = LocalDateTime.now(clock);
        Raffle raffle = lockActiveRaffle(command.raffleId());
        OrderPolicy policy = tenantPolicy.getOrderPolicy(raffle.tenantId());

        List<Integer> numbers = command.numbers();
        validator.validateQuantity(policy, numbers.size());
        validator.validateNumbers(raffle, numbers);

        releaseExpired(raffle, now);

        List<TicketNumber> tickets = ticketNumberRepository.findByNumbersForUpdate(raffle.id(), numbers);

        if (tickets.size() != numbers.size()) {
            Set<Integer> found = new HashSet<>(tickets.stream().map(TicketNumber::number).toList());
            List<Integer> missing = numbers.stream()
                    .filter(number -> !found.contains(number))
                    .sorted()
                    .toList();
            log.warn("Tickets not found: raffleId={}, numbers={}", raffle.id(), missing);
            throw InvalidTicketNumbersException.notFound(missing);
        }

        List<Integer> unavailable = tickets.stream()
                .filter(ticket -> !ticket.isAvailable())
                .map(TicketNumber::number)
                .toList();
        if (!unavailable.isEmpty()) {
            log.warn("Tickets not available: raffleId={}, numbers={}", raffle.id(), unavailable);
            throw new TicketsNotAvailableException(unavailable);
        }

        return createOrder(raffle, tickets, command.contactId(), policy, now);
    }

    /**
     * 무작위 번호 예약
     * 가용 티켓 ID를 커서로 읽으며 저수지 표본 추출 후, 선택된 티켓만 번호 순서로 잠금
     * 추첨 행 락이 다른 예약을 막고 있으므로 재확인은 방어적 검사
     */
    @Transactional
    public RaffleOrder reserveRandom(ReserveRandomTicketsCommand command) {
        LocalDateTime now = LocalDateTime.now(clock);
        Raffle raffle = lockActiveRaffle(command.raffleId());
        OrderPolicy policy = tenantPolicy.getOrderPolicy(raffle.tenantId());

        int quantity = command.quantity();
        validator.validateQuantity(policy, quantity);

        releaseExpired(raffle, now);

        long available = ticketNumberRepository.countByStatus(raffle.id(), TicketStatus.AVAILABLE);
        if (available < quantity) {
            log.warn("Insufficient tickets: raffleId={}, available={}, requested={}", raffle.id(), available, quantity);
            throw new InsufficientTicketsException(available, quantity);
        }

        List<Long> selectedIds;
        try (Stream<Long> availableIds = ticketNumberRepository.streamAvailableIds(raffle.id())) {
            selectedIds = randomSource.sampleWithoutReplacement(availableIds, quantity);
        }

        List<TicketNumber> tickets = ticketNumberRepository.findByIdsForUpdate(selectedIds);
        if (tickets.size() != quantity || tickets.stream().anyMatch(ticket -> !ticket.isAvailable())) {
            log.warn("Random pick lost to a concurrent reservation: raffleId={}", raffle.id());
            throw new ConcurrentReservationException(raffle.id());
        }

        return createOrder(raffle, tickets, command.contactId(), policy, now);
    }

    private Raffle lockActiveRaffle(Long raffleId) {
        return raffleRepository.findActiveByIdForUpdate(raffleId)
                .orElseThrow(() -> {
                    log.warn("Raffle not found or inactive: raffleId={}", raffleId);
                    return new RaffleNotFoundException();
                });
    }

    private void releaseExpired(Raffle raffle, LocalDateTime now) {
        int released = ticketNumberRepository.releaseExpired(raffle.id(), now);
        if (released > 0) {
            log.info("Expired reservations released: raffleId={}, tickets={}", raffle.id(), released);
        }
    }

    private RaffleOrder createOrder(Raffle raffle, List<TicketNumber> tickets, Long contactId,
                                    OrderPolicy policy, LocalDateTime now) {
        RaffleOrder order = orderRepository.save(RaffleOrder.pendingPayment(
                raffle, contactId, tickets.size(), policy.reservationTimeoutMinutes(), now));

        List<TicketNumber> reserved = tickets.stream()
                .map(ticket -> ticket.reserve(order.id(), order.expiresAt()))
                .toList();
        ticketNumberRepository.saveAll(reserved);

        orderTicketRepository.saveAll(reserved.stream()
                .map(ticket -> OrderTicket.link(order.id(), ticket.id()))
                .toList());

        log.info("Tickets reserved: orderId={}, raffleId={}, contactId={}, numbers={}, expiresAt={}",
                order.id(), raffle.id(), contactId,
                reserved.stream().map(TicketNumber::number).toList(), order.expiresAt());
        return order;
    }
}
