package personal.labs.core.identity.application.port.in;

import personal.labs.core.identity.domain.model.CallerIdentity;
import personal.labs.core.identity.domain.model.CallerRole;

/**
 * Authenticate Caller UseCase (Input Port)
 * 요청 헤더의 인증 토큰을 호출자 정보로 변환
 */
public interface AuthenticateCallerUseCase {

    /**
     * @throws personal.labs.core.identity.domain.exception.InvalidAuthTokenException 토큰이 유효하지 않을 때
     * @throws personal.labs.core.identity.domain.exception.IdentityServiceUnavailableException 인증 서비스 장애 시
     */
    CallerIdentity authenticate(String authToken);

    /**
     * 인증 후 역할 검증
     *
     * @throws personal.labs.core.identity.domain.exception.RoleNotPermittedException 허용되지 않은 역할일 때
     */
    CallerIdentity requireRole(String authToken, CallerRole... allowedRoles);
}
