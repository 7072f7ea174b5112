package personal.labs.core.identity.adapter.out.external;

import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import personal.labs.core.identity.application.port.out.IdentityServiceClient;
import personal.labs.core.identity.domain.exception.IdentityServiceUnavailableException;
import personal.labs.core.identity.domain.exception.InvalidAuthTokenException;
import personal.labs.core.identity.domain.model.CallerIdentity;

import java.util.Map;

/**
 * Identity Service REST Client Adapter
 * 인증 서비스와 HTTP 통신하는 구현체 (RestClient 사용)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdentityServiceRestClientAdapter implements IdentityServiceClient {

    private final RestClient identityServiceRestClient;

    /**
     * 토큰 확인
     * - 4xx 에러: InvalidAuthTokenException → ignoreExceptions → Circuit 열지 않음
     * - 5xx 에러, Timeout: Circuit 실패로 카운트
     * - Bulkhead: 동시 호출 수 제한
     * - Retry: Connection 실패, 5xx 만 재시도
     */
    @Override
    @CircuitBreaker(name = "identityService", fallbackMethod = "resolveFallback")
    @Bulkhead(name = "identityService", fallbackMethod = "resolveFallback", type = Bulkhead.Type.SEMAPHORE)
    @Retry(name = "identityService")
    public CallerIdentity resolve(String authToken) {
        log.debug("Introspecting auth token");

        IntrospectResponse response = identityServiceRestClient.post()
                .uri("/api/v1/auth/introspect")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("token", authToken))
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (request, res) -> {
                    log.warn("Auth token rejected: status={}", res.getStatusCode());
                    throw new InvalidAuthTokenException("Auth token rejected by identity service");
                })
                .onStatus(HttpStatusCode::is5xxServerError, (request, res) -> {
                    log.error("Identity service error: status={}", res.getStatusCode());
                    throw new IdentityServiceUnavailableException();
                })
                .body(IntrospectResponse.class);

        if (response == null) {
            throw new InvalidAuthTokenException("Empty introspection response");
        }
        CallerIdentity identity = response.toDomain();

        log.debug("Auth token resolved: userId={}, role={}", identity.userId(), identity.role());
        return identity;
    }

    /**
     * Fallback 메서드
     * 거부된 토큰은 그대로 401로 전달하고, 그 외 장애(Circuit Open, Bulkhead Full, 5xx, Timeout)는 503으로 변환
     */
    private CallerIdentity resolveFallback(String authToken, Exception e) {
        if (e instanceof InvalidAuthTokenException invalid) {
            throw invalid;
        }
        log.error("Identity service unavailable: error={}", e.getClass().getSimpleName(), e);
        throw new IdentityServiceUnavailableException("Identity service unavailable", e);
    }
}
