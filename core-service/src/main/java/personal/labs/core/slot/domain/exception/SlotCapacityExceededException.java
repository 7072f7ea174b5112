package personal.labs.core.slot.domain.exception;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;

/**
 * Slot Capacity Exceeded Exception
 * 예약 인원이 정원을 넘게 되는 변경을 거부할 때 발생 (CapacityError)
 */
public class SlotCapacityExceededException extends BusinessException {
    public SlotCapacityExceededException(Long slotId, int maxStudents, int requiredSeats) {
        super(ErrorCode.SLOT_CAPACITY_BELOW_BOOKINGS,
                String.format("Capacity would be exceeded: slotId=%s, maxStudents=%d, required=%d",
                        slotId, maxStudents, requiredSeats));
    }
}
