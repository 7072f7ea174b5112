package personal.labs.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "C002", "인증이 필요합니다."),
    FORBIDDEN(HttpStatus.FORBIDDEN, "C003", "권한이 없습니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Slot Domain (Sxxx)
    SLOT_NOT_FOUND(HttpStatus.NOT_FOUND, "S001", "실습 세션을 찾을 수 없습니다."),
    INVALID_SLOT(HttpStatus.BAD_REQUEST, "S002", "실습 세션 정보가 올바르지 않습니다."),
    SLOT_ACCESS_DENIED(HttpStatus.FORBIDDEN, "S003", "해당 실습 세션을 관리할 권한이 없습니다."),
    SLOT_CAPACITY_BELOW_BOOKINGS(HttpStatus.CONFLICT, "S004", "정원을 현재 예약 인원보다 작게 설정할 수 없습니다."),

    // Booking Domain (Bxxx)
    BOOKING_NOT_FOUND(HttpStatus.NOT_FOUND, "B001", "예약을 찾을 수 없습니다."),
    BOOKING_ACCESS_DENIED(HttpStatus.FORBIDDEN, "B002", "해당 예약에 접근할 권한이 없습니다."),
    SLOT_FULL(HttpStatus.CONFLICT, "B003", "실습 세션의 정원이 모두 찼습니다."),
    DUPLICATE_BOOKING(HttpStatus.CONFLICT, "B004", "이미 예약한 실습 세션입니다."),
    SLOT_INACTIVE(HttpStatus.CONFLICT, "B005", "현재 예약할 수 없는 실습 세션입니다."),
    // 중복 취소는 실패가 아닌 no-op 이므로 200 으로 응답
    BOOKING_ALREADY_CANCELLED(HttpStatus.OK, "B006", "이미 취소된 예약입니다."),

    // Identity (Axxx)
    INVALID_AUTH_TOKEN(HttpStatus.UNAUTHORIZED, "A001", "유효하지 않은 인증 토큰입니다."),
    ROLE_NOT_PERMITTED(HttpStatus.FORBIDDEN, "A002", "요청한 기능을 사용할 수 없는 역할입니다."),

    // External Service (Exxx)
    EXTERNAL_SERVICE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "E001", "외부 서비스 오류가 발생했습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
