package personal.labs.core.booking.adapter.in.web.dto;

import personal.labs.core.booking.domain.model.Booking;
import personal.labs.core.booking.domain.model.BookingStatus;

import java.time.LocalDateTime;

/**
 * 예약 생성/취소/조회 응답 DTO
 */
public record BookingResponse(
        Long bookingId,
        Long slotId,
        Long studentId,
        String studentName,
        String notes,
        BookingStatus status,
        LocalDateTime createdAt,
        LocalDateTime cancelledAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.id(),
                booking.slotId(),
                booking.studentId(),
                booking.studentName(),
                booking.notes(),
                booking.status(),
                booking.createdAt(),
                booking.cancelledAt()
        );
    }
}
