package personal.reserve.core.raffle.domain.model;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Raffle Domain Model
 * [minNumber, maxNumber] 범위의 번호 티켓을 장당 가격으로 판매하는 추첨 (불변)
 */
public record Raffle(
        Long id,
        Long tenantId,
        String title,
        String description,
        BigDecimal ticketPrice,
        String currency,
        boolean active,
        int minNumber,
        int maxNumber,
        LocalDateTime drawDate,
        LocalDateTime createdAt
) {
    public Raffle {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (title == null || title.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Raffle title cannot be null or blank");
        }
        if (ticketPrice == null || ticketPrice.signum() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Ticket price must be greater than zero");
        }
        if (currency == null || currency.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Currency cannot be null or blank");
        }
        if (minNumber < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Minimum number must be at least 1");
        }
        if (maxNumber < minNumber) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Maximum number must be greater than or equal to minimum number");
        }
    }

    public int totalTickets() {
        return maxNumber - minNumber + 1;
    }

    public boolean contains(int number) {
        return number >= minNumber && number <= maxNumber;
    }

    /**
     * 주문 금액 = 장당 가격 x 수량
     */
    public BigDecimal priceFor(int quantity) {
        return ticketPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
