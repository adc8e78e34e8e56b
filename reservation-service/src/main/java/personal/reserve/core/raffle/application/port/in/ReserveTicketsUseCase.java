package personal.reserve.core.raffle.application.port.in;

import personal.reserve.core.raffle.domain.model.RaffleOrder;

/**
 * Reserve Tickets UseCase (Input Port)
 * 추첨 티켓 예약 (지정 번호 / 무작위)
 */
public interface ReserveTicketsUseCase {

    /**
     * 지정 번호 예약
     *
     * @return 결제 대기 주문 (PENDING_PAYMENT)
     */
    RaffleOrder reserveSpecific(ReserveSpecificTicketsCommand command);

    /**
     * 무작위 번호 예약
     *
     * @return 결제 대기 주문 (PENDING_PAYMENT)
     */
    RaffleOrder reserveRandom(ReserveRandomTicketsCommand command);
}
