package personal.labs.core.identity.domain.exception;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;

/**
 * Invalid Auth Token Exception
 * 토큰이 없거나, 만료되었거나, 인증 서비스가 거부했을 때 발생
 */
public class InvalidAuthTokenException extends BusinessException {
    public InvalidAuthTokenException() {
        super(ErrorCode.INVALID_AUTH_TOKEN);
    }

    public InvalidAuthTokenException(String detail) {
        super(ErrorCode.INVALID_AUTH_TOKEN, detail);
    }
}
