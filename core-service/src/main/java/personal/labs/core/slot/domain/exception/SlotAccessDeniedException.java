package personal.labs.core.slot.domain.exception;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;

/**
 * Slot Access Denied Exception
 * 담당 교사가 아닌 사용자가 세션을 변경하거나 명단을 조회할 때 발생
 */
public class SlotAccessDeniedException extends BusinessException {
    public SlotAccessDeniedException(Long slotId, Long teacherId) {
        super(ErrorCode.SLOT_ACCESS_DENIED,
                String.format("Teacher %d does not own slot %d", teacherId, slotId));
    }
}
