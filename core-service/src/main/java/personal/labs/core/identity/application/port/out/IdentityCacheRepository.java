package personal.labs.core.identity.application.port.out;

import personal.labs.core.identity.domain.model.CallerIdentity;

import java.util.Optional;

/**
 * Identity Cache Repository (Output Port)
 * 토큰 확인 결과 단기 캐시. 구현체는 장애 시 캐시 미스로 동작해야 한다
 */
public interface IdentityCacheRepository {

    Optional<CallerIdentity> find(String authToken);

    void save(String authToken, CallerIdentity identity);
}
