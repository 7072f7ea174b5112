package personal.labs.core.booking.domain.exception;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;

/**
 * Booking Not Found Exception
 * 예약을 찾을 수 없을 때 발생하는 예외
 */
public class BookingNotFoundException extends BusinessException {
    public BookingNotFoundException(Long bookingId) {
        super(ErrorCode.BOOKING_NOT_FOUND, String.format("Booking not found: bookingId=%d", bookingId));
    }
}
