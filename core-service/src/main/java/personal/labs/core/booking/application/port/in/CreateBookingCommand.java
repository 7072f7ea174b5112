package personal.labs.core.booking.application.port.in;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;
import personal.labs.core.booking.domain.model.Booking;

/**
 * Create Booking Command
 * 좌석 예약 커맨드
 */
public record CreateBookingCommand(
        Long studentId,
        String studentName,
        Long slotId,
        String notes
) {
    public CreateBookingCommand {
        if (studentId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Student ID cannot be null");
        }
        if (slotId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot ID cannot be null");
        }
        // 좌석 확보 전에 검증
        if (notes != null && notes.strip().length() > Booking.MAX_NOTES_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Notes cannot exceed " + Booking.MAX_NOTES_LENGTH + " characters");
        }
    }
}
