package personal.labs.core.booking.domain.exception;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;

/**
 * Booking Already Cancelled Exception
 * 이미 취소된 예약을 다시 취소할 때 발생 (no-op, 세션 인원은 변하지 않음)
 */
public class BookingAlreadyCancelledException extends BusinessException {
    public BookingAlreadyCancelledException(Long bookingId) {
        super(ErrorCode.BOOKING_ALREADY_CANCELLED,
                String.format("Booking already cancelled: bookingId=%d", bookingId));
    }
}
