package personal.labs.core.identity.domain.model;

/**
 * 호출자 역할
 */
public enum CallerRole {
    STUDENT,
    TEACHER,
    ADMIN
}
