package personal.labs.core.slot.domain.exception;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;

/**
 * Invalid Slot Exception
 * 실습 세션 입력값이 불변식을 위반할 때 발생 (ValidationError)
 */
public class InvalidSlotException extends BusinessException {
    public InvalidSlotException(String detail) {
        super(ErrorCode.INVALID_SLOT, detail);
    }
}
