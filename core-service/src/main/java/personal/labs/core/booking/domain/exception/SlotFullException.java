package personal.labs.core.booking.domain.exception;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;

/**
 * Slot Full Exception
 * 세션 정원이 모두 차서 좌석을 확보하지 못했을 때 발생
 */
public class SlotFullException extends BusinessException {
    public SlotFullException(Long slotId, Throwable cause) {
        super(ErrorCode.SLOT_FULL, String.format("Slot is full: slotId=%d", slotId), cause);
    }
}
