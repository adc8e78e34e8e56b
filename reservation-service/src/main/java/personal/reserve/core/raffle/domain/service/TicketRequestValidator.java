package personal.reserve.core.raffle.domain.service;

import org.springframework.stereotype.Component;
import personal.reserve.core.raffle.domain.exception.InvalidTicketNumbersException;
import personal.reserve.core.raffle.domain.exception.InvalidTicketQuantityException;
import personal.reserve.core.raffle.domain.model.Raffle;
import personal.reserve.core.tenant.domain.model.OrderPolicy;

import java.util.HashSet;
import java.util.List;

/**
 * Ticket Request Validator
 * 수량 한도 -> 번호 범위 -> 중복 순서로 검증
 */
@Component
public class TicketRequestValidator {

    public void validateQuantity(OrderPolicy policy, int quantity) {
        if (quantity < policy.minTicketsPerOrder()) {
            throw InvalidTicketQuantityException.belowMinimum(policy.minTicketsPerOrder());
        }
        if (quantity > policy.maxTicketsPerOrder()) {
            throw InvalidTicketQuantityException.aboveMaximum(policy.maxTicketsPerOrder());
        }
    }

    public void validateNumbers(Raffle raffle, List<Integer> numbers) {
        List<Integer> outOfRange = numbers.stream()
                .filter(number -> !raffle.contains(number))
                .toList();
        if (!outOfRange.isEmpty()) {
            throw InvalidTicketNumbersException.outOfRange(outOfRange);
        }

        if (new HashSet<>(numbers).size() != numbers.size()) {
            throw InvalidTicketNumbersException.duplicated();
        }
    }
}
