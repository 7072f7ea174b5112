package personal.labs.core.identity.domain.exception;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;

/**
 * Identity Service Unavailable Exception
 * 인증 서비스에 연결할 수 없을 때 발생 (5xx, Timeout, Circuit Breaker Open, Bulkhead Full)
 */
public class IdentityServiceUnavailableException extends BusinessException {
    public IdentityServiceUnavailableException() {
        super(ErrorCode.EXTERNAL_SERVICE_ERROR, "Identity service unavailable");
    }

    public IdentityServiceUnavailableException(String detail, Throwable cause) {
        super(ErrorCode.EXTERNAL_SERVICE_ERROR, detail, cause);
    }
}
