package personal.reserve.core.raffle.application.port.in;

import personal.reserve.core.raffle.domain.model.Raffle;
import personal.reserve.core.raffle.domain.model.RaffleInventory;

/**
 * Manage Raffle UseCase (Input Port)
 * 추첨 등록, 티켓 생성, 재고 조회
 */
public interface ManageRaffleUseCase {

    Raffle createRaffle(CreateRaffleCommand command);

    /**
     * 추첨 범위의 번호마다 AVAILABLE 티켓 생성
     * 이미 티켓이 있으면 force일 때만 재생성 (예약/판매된 티켓이 있으면 거부)
     *
     * @return 생성된 티켓 수
     */
    int generateTickets(Long raffleId, boolean force);

    RaffleInventory getInventory(Long raffleId);
}
