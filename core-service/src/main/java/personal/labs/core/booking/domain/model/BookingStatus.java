package personal.labs.core.booking.domain.model;

/**
 * Booking Status Enum
 * 예약 상태 (CONFIRMED -> CANCELLED 단방향 전이)
 */
public enum BookingStatus {
    /**
     * 좌석 확보 완료
     */
    CONFIRMED,

    /**
     * 학생 취소 또는 세션 삭제로 인한 취소 (종료 상태)
     */
    CANCELLED
}
