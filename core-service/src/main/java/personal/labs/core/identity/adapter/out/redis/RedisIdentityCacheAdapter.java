package personal.labs.core.identity.adapter.out.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import personal.labs.core.identity.application.port.out.IdentityCacheRepository;
import personal.labs.core.identity.domain.model.CallerIdentity;
import personal.labs.core.identity.domain.model.CallerRole;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Redis Identity Cache Adapter
 *
 * 인증 서비스 호출 최적화:
 * - 동일 토큰에 대한 반복 확인 방지
 * - Cache Key: "identity:token:{tokenHash}" (SHA-256, 토큰 원문은 키에 노출되지 않음)
 * - Redis 장애 시 캐시 미스로 처리 (인증 서비스 호출로 fallback)
 */
@Slf4j
@Component
public class RedisIdentityCacheAdapter implements IdentityCacheRepository {

    private static final String CACHE_KEY_PREFIX = "identity:token:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration cacheTtl;

    public RedisIdentityCacheAdapter(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            @Value("${lab.identity.cache-ttl-seconds:10}") long cacheTtlSeconds) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.cacheTtl = Duration.ofSeconds(cacheTtlSeconds);
    }

    @Override
    public Optional<CallerIdentity> find(String authToken) {
        try {
            String cached = redisTemplate.opsForValue().get(buildCacheKey(authToken));
            if (cached == null) {
                log.debug("Identity cache MISS");
                return Optional.empty();
            }
            log.debug("Identity cache HIT");
            return Optional.of(objectMapper.readValue(cached, CachedIdentity.class).toDomain());
        } catch (Exception e) {
            log.warn("Identity cache read error, treating as MISS: error={}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(String authToken, CallerIdentity identity) {
        try {
            redisTemplate.opsForValue().set(
                    buildCacheKey(authToken), objectMapper.writeValueAsString(CachedIdentity.from(identity)), cacheTtl);
            log.debug("Identity cached: userId={}, ttl={}s", identity.userId(), cacheTtl.getSeconds());
        } catch (JsonProcessingException e) {
            log.warn("Identity cache serialization error: userId={}, error={}", identity.userId(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Identity cache write error: userId={}, error={}", identity.userId(), e.getMessage());
        }
    }

    private String buildCacheKey(String authToken) {
        return CACHE_KEY_PREFIX + hashToken(authToken);
    }

    private String hashToken(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(token.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Redis 저장 형식
     */
    record CachedIdentity(Long userId, String name, CallerRole role, Integer level) {

        static CachedIdentity from(CallerIdentity identity) {
            return new CachedIdentity(identity.userId(), identity.name(), identity.role(), identity.level());
        }

        CallerIdentity toDomain() {
            return new CallerIdentity(userId, name, role, level);
        }
    }
}
