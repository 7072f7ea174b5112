package personal.labs.core.booking.application.port.in;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;

/**
 * Cancel Booking Command
 * 예약 취소 커맨드
 */
public record CancelBookingCommand(
        Long bookingId,
        Long studentId
) {
    public CancelBookingCommand {
        if (bookingId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking ID cannot be null");
        }
        if (studentId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Student ID cannot be null");
        }
    }
}
