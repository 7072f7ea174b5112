package personal.labs.core.booking.application.port.in;

import personal.labs.core.booking.domain.model.Booking;
import personal.labs.core.slot.domain.model.Slot;

/**
 * Student Booking View
 * 학생 예약 이력 한 건과 해당 세션 정보 (세션이 삭제된 경우 slot은 null)
 */
public record StudentBookingView(
        Booking booking,
        Slot slot
) {
    public boolean hasSlot() {
        return slot != null;
    }
}
