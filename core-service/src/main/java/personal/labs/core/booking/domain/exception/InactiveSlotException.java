package personal.labs.core.booking.domain.exception;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;

/**
 * Inactive Slot Exception
 * 비활성화된 세션에 예약을 시도할 때 발생
 */
public class InactiveSlotException extends BusinessException {
    public InactiveSlotException(Long slotId) {
        super(ErrorCode.SLOT_INACTIVE, String.format("Slot is not active: slotId=%d", slotId));
    }
}
