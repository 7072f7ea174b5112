package personal.labs.core.slot.application.port.in;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;
import personal.labs.core.slot.domain.model.SlotDetails;

/**
 * Create Slot Command
 * 실습 세션 생성 커맨드
 */
public record CreateSlotCommand(
        Long teacherId,
        String teacherName,
        SlotDetails details
) {
    public CreateSlotCommand {
        if (teacherId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Teacher ID cannot be null");
        }
        if (details == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot details cannot be null");
        }
    }
}
