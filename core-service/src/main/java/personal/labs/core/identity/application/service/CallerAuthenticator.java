package personal.labs.core.identity.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.labs.core.identity.application.port.in.AuthenticateCallerUseCase;
import personal.labs.core.identity.application.port.out.IdentityCacheRepository;
import personal.labs.core.identity.application.port.out.IdentityServiceClient;
import personal.labs.core.identity.domain.exception.InvalidAuthTokenException;
import personal.labs.core.identity.domain.exception.RoleNotPermittedException;
import personal.labs.core.identity.domain.model.CallerIdentity;
import personal.labs.core.identity.domain.model.CallerRole;

import java.util.Optional;

/**
 * Caller Authenticator
 * 캐시 조회 → 인증 서비스 호출 → 캐시 저장 순서로 호출자를 확인한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallerAuthenticator implements AuthenticateCallerUseCase {

    private final IdentityServiceClient identityServiceClient;
    private final IdentityCacheRepository identityCacheRepository;

    @Override
    public CallerIdentity authenticate(String authToken) {
        if (authToken == null || authToken.isBlank()) {
            throw new InvalidAuthTokenException("Auth token is missing");
        }

        Optional<CallerIdentity> cached = identityCacheRepository.find(authToken);
        if (cached.isPresent()) {
            return cached.get();
        }

        CallerIdentity identity = identityServiceClient.resolve(authToken);
        identityCacheRepository.save(authToken, identity);

        log.debug("Caller authenticated: userId={}, role={}", identity.userId(), identity.role());
        return identity;
    }

    @Override
    public CallerIdentity requireRole(String authToken, CallerRole... allowedRoles) {
        CallerIdentity identity = authenticate(authToken);
        if (!identity.hasAnyRole(allowedRoles)) {
            log.warn("Role not permitted: userId={}, role={}", identity.userId(), identity.role());
            throw new RoleNotPermittedException(identity.userId(), identity.role(), allowedRoles);
        }
        return identity;
    }
}
