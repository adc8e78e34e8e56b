package personal.reserve.core.tenant.domain.exception;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;

/**
 * Tenant Not Found Exception
 * 테넌트를 찾을 수 없을 때 발생하는 예외
 */
public class TenantNotFoundException extends BusinessException {
    public TenantNotFoundException(Long tenantId) {
        super(ErrorCode.TENANT_NOT_FOUND, String.format("Tenant not found: tenantId=%d", tenantId));
    }
}
