package personal.labs.core.booking.domain.model;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;
import personal.labs.core.booking.domain.exception.BookingAccessDeniedException;
import personal.labs.core.booking.domain.exception.BookingAlreadyCancelledException;

import java.time.LocalDateTime;

/**
 * Booking Domain Model
 * 학생 한 명이 세션 좌석 하나를 예약한 기록 (불변)
 * 취소는 상태 변경일 뿐 기록은 삭제하지 않는다
 */
public record Booking(
        Long id,
        Long slotId,
        Long studentId,
        String studentName,
        String notes,
        BookingStatus status,
        LocalDateTime createdAt,
        LocalDateTime cancelledAt) {

    public static final int MAX_NOTES_LENGTH = 500;

    public Booking {
        if (slotId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot ID cannot be null");
        }
        if (studentId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Student ID cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking status cannot be null");
        }
        if (createdAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Creation time cannot be null");
        }
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Notes cannot exceed " + MAX_NOTES_LENGTH + " characters");
        }
    }

    /**
     * 예약 생성 (정적 팩토리 메서드)
     *
     * @param slotId      세션 ID
     * @param studentId   학생 ID
     * @param studentName 학생 표시 이름 (명단 표시용)
     * @param notes       메모 (선택)
     * @return 새로운 예약 (CONFIRMED 상태)
     */
    public static Booking create(Long slotId, Long studentId, String studentName, String notes) {
        String normalizedNotes = (notes == null || notes.isBlank()) ? null : notes.strip();
        return new Booking(
                null,
                slotId,
                studentId,
                studentName,
                normalizedNotes,
                BookingStatus.CONFIRMED,
                LocalDateTime.now(),
                null);
    }

    /**
     * 예약 취소 (CONFIRMED -> CANCELLED)
     */
    public Booking cancel() {
        if (status != BookingStatus.CONFIRMED) {
            throw new IllegalStateException(
                    String.format("Cannot cancel booking in %s status. Booking ID: %d", status, id));
        }
        return new Booking(id, slotId, studentId, studentName, notes,
                BookingStatus.CANCELLED, createdAt, LocalDateTime.now());
    }

    public boolean isConfirmed() {
        return status == BookingStatus.CONFIRMED;
    }

    public boolean isCancelled() {
        return status == BookingStatus.CANCELLED;
    }

    // ========== Domain Validation Methods (Tell, Don't Ask) ==========

    /**
     * 소유권 검증
     *
     * @param requestStudentId 요청 학생 ID
     * @throws BookingAccessDeniedException 소유권 불일치 시
     */
    public void ensureOwnership(Long requestStudentId) {
        if (!this.studentId.equals(requestStudentId)) {
            throw new BookingAccessDeniedException(id, requestStudentId);
        }
    }

    /**
     * CONFIRMED 상태 검증
     *
     * @throws BookingAlreadyCancelledException 이미 취소된 예약일 때 (no-op)
     */
    public void ensureConfirmed() {
        if (!isConfirmed()) {
            throw new BookingAlreadyCancelledException(id);
        }
    }
}
