package personal.labs.core.booking.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import personal.labs.core.booking.application.port.in.StudentBookingView;
import personal.labs.core.booking.domain.model.Booking;
import personal.labs.core.booking.domain.model.BookingStatus;
import personal.labs.core.slot.domain.model.Slot;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 학생 예약 이력 응답 DTO
 * 세션이 삭제된 예약은 slot 이 null
 */
public record StudentBookingResponse(
        Long bookingId,
        BookingStatus status,
        String notes,
        LocalDateTime createdAt,
        LocalDateTime cancelledAt,
        Long slotId,
        SlotSummary slot
) {
    public static StudentBookingResponse from(StudentBookingView view) {
        Booking booking = view.booking();
        return new StudentBookingResponse(
                booking.id(),
                booking.status(),
                booking.notes(),
                booking.createdAt(),
                booking.cancelledAt(),
                booking.slotId(),
                view.hasSlot() ? SlotSummary.from(view.slot()) : null
        );
    }

    public record SlotSummary(
            String topic,
            String teacherName,
            LocalDate date,
            @JsonFormat(pattern = "HH:mm")
            LocalTime startTime,
            @JsonFormat(pattern = "HH:mm")
            LocalTime endTime,
            long durationMinutes,
            String location
    ) {
        static SlotSummary from(Slot slot) {
            return new SlotSummary(
                    slot.topic(),
                    slot.teacherName(),
                    slot.date(),
                    slot.startTime(),
                    slot.endTime(),
                    slot.durationMinutes(),
                    slot.location()
            );
        }
    }
}
