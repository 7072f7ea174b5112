package personal.labs.core.slot.domain.exception;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;

/**
 * Slot Not Found Exception
 * 실습 세션을 찾을 수 없을 때 발생하는 예외
 */
public class SlotNotFoundException extends BusinessException {
    public SlotNotFoundException(Long slotId) {
        super(ErrorCode.SLOT_NOT_FOUND, String.format("Slot not found: slotId=%d", slotId));
    }
}
