package personal.reserve.core.raffle.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.TransientInfrastructureException;
import personal.reserve.core.raffle.application.port.in.ReserveRandomTicketsCommand;
import personal.reserve.core.raffle.application.port.in.ReserveSpecificTicketsCommand;
import personal.reserve.core.raffle.application.port.in.ReserveTicketsUseCase;
import personal.reserve.core.raffle.domain.model.RaffleOrder;
import personal.reserve.core.raffle.domain.service.TicketReservationManager;
import personal.reserve.core.support.StoreFailures;

import java.util.function.Supplier;

/**
 * Ticket Reservation Service
 * 단일 책임: 티켓 예약 요청 처리 (트랜잭션은 TicketReservationManager가 담당)
 * 락 대기 시간 초과는 재시도 가능한 인프라 예외로 변환하고, 결과별 카운터를 기록
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketReservationService implements ReserveTicketsUseCase {

    private static final String MODE_SPECIFIC = "specific";
    private static final String MODE_RANDOM = "random";

    private final TicketReservationManager reservationManager;
    private final MeterRegistry meterRegistry;

    @Override
    public RaffleOrder reserveSpecific(ReserveSpecificTicketsCommand command) {
        log.debug("Reserving specific tickets: raffleId={}, numbers={}, contactId={}",
                command.raffleId(), command.numbers(), command.contactId());

        return recordOutcome(MODE_SPECIFIC,
                () -> StoreFailures.translate("reserveSpecific", () -> reservationManager.reserveSpecific(command)));
    }

    @Override
    public RaffleOrder reserveRandom(ReserveRandomTicketsCommand command) {
        log.debug("Reserving random tickets: raffleId={}, quantity={}, contactId={}",
                command.raffleId(), command.quantity(), command.contactId());

        return recordOutcome(MODE_RANDOM,
                () -> StoreFailures.translate("reserveRandom", () -> reservationManager.reserveRandom(command)));
    }

    private RaffleOrder recordOutcome(String mode, Supplier<RaffleOrder> reservation) {
        try {
            RaffleOrder order = reservation.get();
            count(mode, "reserved", order.quantity());
            return order;

        } catch (BusinessException e) {
            count(mode, "rejected", 1);
            throw e;

        } catch (TransientInfrastructureException e) {
            count(mode, "lock_failure", 1);
            throw e;
        }
    }

    private void count(String mode, String outcome, int amount) {
        Counter.builder("raffle.reservation.requests")
                .tag("mode", mode)
                .tag("outcome", outcome)
                .description("Ticket reservation requests by outcome")
                .register(meterRegistry)
                .increment();

        if ("reserved".equals(outcome)) {
            Counter.builder("raffle.reservation.tickets")
                    .tag("mode", mode)
                    .description("Number of tickets reserved")
                    .register(meterRegistry)
                    .increment(amount);
        }
    }
}
