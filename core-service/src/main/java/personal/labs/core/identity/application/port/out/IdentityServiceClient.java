package personal.labs.core.identity.application.port.out;

import personal.labs.core.identity.domain.model.CallerIdentity;

/**
 * Identity Service Client (Output Port)
 * 외부 인증 서비스와의 통신 인터페이스
 */
public interface IdentityServiceClient {

    /**
     * 인증 토큰 확인
     *
     * @param authToken 요청 헤더의 토큰
     * @return 토큰 소유자 정보
     * @throws personal.labs.core.identity.domain.exception.InvalidAuthTokenException 토큰이 거부되었을 때
     * @throws personal.labs.core.identity.domain.exception.IdentityServiceUnavailableException 서비스 장애 시
     */
    CallerIdentity resolve(String authToken);
}
