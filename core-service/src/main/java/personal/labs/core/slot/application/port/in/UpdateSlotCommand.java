package personal.labs.core.slot.application.port.in;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;
import personal.labs.core.slot.domain.model.SlotDetails;

/**
 * Update Slot Command
 * 실습 세션 수정 커맨드 (편집 가능 속성 전체 교체)
 */
public record UpdateSlotCommand(
        Long slotId,
        Long teacherId,
        SlotDetails details
) {
    public UpdateSlotCommand {
        if (slotId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot ID cannot be null");
        }
        if (teacherId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Teacher ID cannot be null");
        }
        if (details == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot details cannot be null");
        }
    }
}
