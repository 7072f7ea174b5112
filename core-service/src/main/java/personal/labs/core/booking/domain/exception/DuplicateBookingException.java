package personal.labs.core.booking.domain.exception;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;

/**
 * Duplicate Booking Exception
 * 같은 학생이 같은 세션에 확정 예약을 이미 가지고 있을 때 발생
 */
public class DuplicateBookingException extends BusinessException {
    public DuplicateBookingException(Long slotId, Long studentId) {
        super(ErrorCode.DUPLICATE_BOOKING,
                String.format("Active booking already exists: slotId=%d, studentId=%d", slotId, studentId));
    }
}
