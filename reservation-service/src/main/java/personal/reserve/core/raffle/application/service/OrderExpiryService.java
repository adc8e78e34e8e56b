package personal.reserve.core.raffle.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.TransientInfrastructureException;
import personal.reserve.core.raffle.application.port.in.ExpireOrdersUseCase;
import personal.reserve.core.raffle.application.port.out.OrderRepository;
import personal.reserve.core.raffle.domain.exception.OrderNotFoundException;
import personal.reserve.core.raffle.domain.service.OrderLifecycleManager;
import personal.reserve.core.support.StoreFailures;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Order Expiry Service
 * 주문 만료 판단과 처리
 * 예약 경로의 lazy sweep이 정합성을 보장하고, 여기서의 일괄 만료는 보조 수단
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderExpiryService implements ExpireOrdersUseCase {

    private final OrderRepository orderRepository;
    private final OrderLifecycleManager lifecycleManager;
    private final Clock clock;

    @Override
    public boolean isExpired(Long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId))
                .isExpired(LocalDateTime.now(clock));
    }

    @Override
    public boolean markExpired(Long orderId) {
        return StoreFailures.translate("markExpired", () -> lifecycleManager.markExpired(orderId));
    }

    @Override
    public int expireOverdueOrders(int batchSize) {
        List<Long> overdue = orderRepository.findOverduePendingIds(LocalDateTime.now(clock), batchSize);
        if (overdue.isEmpty()) {
            return 0;
        }

        int expired = 0;
        for (Long orderId : overdue) {
            try {
                if (markExpired(orderId)) {
                    expired++;
                }
            } catch (BusinessException | TransientInfrastructureException e) {
                // 다음 주기에 다시 시도
                log.warn("Failed to expire order: orderId={}, reason={}", orderId, e.getMessage());
            }
        }

        log.info("Overdue orders expired: candidates={}, expired={}", overdue.size(), expired);
        return expired;
    }
}
