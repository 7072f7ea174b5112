package personal.labs.core.identity.domain.exception;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;
import personal.labs.core.identity.domain.model.CallerRole;

import java.util.Arrays;

/**
 * Role Not Permitted Exception
 * 호출자의 역할로는 사용할 수 없는 기능일 때 발생
 */
public class RoleNotPermittedException extends BusinessException {
    public RoleNotPermittedException(Long userId, CallerRole actual, CallerRole... required) {
        super(ErrorCode.ROLE_NOT_PERMITTED,
                String.format("Role not permitted: userId=%d, role=%s, required=%s",
                        userId, actual, Arrays.toString(required)));
    }
}
