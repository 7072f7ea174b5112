package personal.labs.core.identity.adapter.out.external;

import personal.labs.core.identity.domain.exception.InvalidAuthTokenException;
import personal.labs.core.identity.domain.model.CallerIdentity;
import personal.labs.core.identity.domain.model.CallerRole;

/**
 * 인증 서비스 토큰 확인 응답
 */
public record IntrospectResponse(
        Long userId,
        String name,
        String role,
        Integer level
) {
    public CallerIdentity toDomain() {
        if (role == null) {
            throw new InvalidAuthTokenException("Introspection response without role: userId=" + userId);
        }
        try {
            return new CallerIdentity(userId, name, CallerRole.valueOf(role.toUpperCase()), level);
        } catch (IllegalArgumentException e) {
            throw new InvalidAuthTokenException("Unknown role in introspection response: " + role);
        }
    }
}
