package personal.reserve.core.raffle.application.port.in;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Create Raffle Command
 */
public record CreateRaffleCommand(
        Long tenantId,
        String title,
        String description,
        BigDecimal ticketPrice,
        String currency,
        int minNumber,
        int maxNumber,
        LocalDateTime drawDate
) {
    public CreateRaffleCommand {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (currency == null || currency.isBlank()) {
            currency = "USD";
        }
    }
}
