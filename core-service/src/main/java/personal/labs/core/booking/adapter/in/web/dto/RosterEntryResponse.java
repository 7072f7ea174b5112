package personal.labs.core.booking.adapter.in.web.dto;

import personal.labs.core.booking.domain.model.Booking;

import java.time.LocalDateTime;

/**
 * 세션 명단 항목 응답 DTO
 */
public record RosterEntryResponse(
        Long bookingId,
        Long studentId,
        String studentName,
        String notes,
        LocalDateTime bookedAt
) {
    public static RosterEntryResponse from(Booking booking) {
        return new RosterEntryResponse(
                booking.id(),
                booking.studentId(),
                booking.studentName(),
                booking.notes(),
                booking.createdAt()
        );
    }
}
