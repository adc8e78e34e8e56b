package personal.reserve.core.tenant.domain.model;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;

/**
 * Tenant Domain Model
 * 격리 경계 (모든 서비스, 고객, 예약, 추첨은 하나의 테넌트에 속함)
 */
public record Tenant(
        Long id,
        String slug,
        String name,
        boolean active,
        TenantSettings settings
) {
    public Tenant {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (slug == null || slug.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant slug cannot be null or blank");
        }
        if (settings == null) {
            settings = TenantSettings.empty();
        }
    }
}
