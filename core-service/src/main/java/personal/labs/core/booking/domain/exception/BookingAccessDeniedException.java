package personal.labs.core.booking.domain.exception;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;

/**
 * Booking Access Denied Exception
 * 예약한 학생 본인이 아닐 때 발생
 */
public class BookingAccessDeniedException extends BusinessException {
    public BookingAccessDeniedException(Long bookingId, Long studentId) {
        super(ErrorCode.BOOKING_ACCESS_DENIED,
                String.format("Student %d does not own booking %d", studentId, bookingId));
    }
}
