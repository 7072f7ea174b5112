package personal.labs.core.identity.domain.model;

import personal.labs.core.identity.domain.exception.InvalidAuthTokenException;

import java.util.Arrays;

/**
 * Caller Identity
 * 인증 토큰으로 확인된 호출자 (userId, 표시 이름, 역할, 학생 레벨)
 * level은 학생에게만 의미가 있으며 교사/관리자는 null 일 수 있다
 */
public record CallerIdentity(
        Long userId,
        String name,
        CallerRole role,
        Integer level
) {
    public CallerIdentity {
        if (userId == null || role == null) {
            throw new InvalidAuthTokenException("Identity must carry user ID and role");
        }
        if (role == CallerRole.STUDENT && (level == null || level < 1)) {
            throw new InvalidAuthTokenException("Student identity must carry a positive level: userId=" + userId);
        }
    }

    public boolean hasAnyRole(CallerRole... roles) {
        return Arrays.asList(roles).contains(role);
    }

    public boolean isStudent() {
        return role == CallerRole.STUDENT;
    }

    public boolean isAdmin() {
        return role == CallerRole.ADMIN;
    }
}
