package personal.labs.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.labs.core.booking.application.port.in.CreateBookingCommand;
import personal.labs.core.booking.domain.model.Booking;

/**
 * 좌석 예약 요청 DTO
 */
public record CreateBookingRequest(
        @NotNull(message = "세션 ID는 필수입니다.")
        Long slotId,

        @Size(max = Booking.MAX_NOTES_LENGTH, message = "메모는 500자 이하여야 합니다.")
        String notes
) {
    public CreateBookingCommand toCommand(Long studentId, String studentName) {
        return new CreateBookingCommand(studentId, studentName, slotId, notes);
    }
}
