package personal.labs.core.slot.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import personal.labs.core.slot.domain.model.Slot;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 실습 세션 조회/생성 응답 DTO
 * bookedByMe 는 학생의 예약 가능 목록에서만 채워진다
 */
public record SlotResponse(
        Long slotId,
        Long teacherId,
        String teacherName,
        int level,
        LocalDate date,
        @JsonFormat(pattern = "HH:mm")
        LocalTime startTime,
        @JsonFormat(pattern = "HH:mm")
        LocalTime endTime,
        long durationMinutes,
        String topic,
        String description,
        String location,
        int maxStudents,
        int currentBookings,
        int remainingSeats,
        boolean active,
        LocalDateTime createdAt,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        Boolean bookedByMe
) {
    public static SlotResponse from(Slot slot) {
        return of(slot, null);
    }

    public static SlotResponse from(Slot slot, boolean bookedByMe) {
        return of(slot, bookedByMe);
    }

    private static SlotResponse of(Slot slot, Boolean bookedByMe) {
        return new SlotResponse(
                slot.id(),
                slot.teacherId(),
                slot.teacherName(),
                slot.level(),
                slot.date(),
                slot.startTime(),
                slot.endTime(),
                slot.durationMinutes(),
                slot.topic(),
                slot.description(),
                slot.location(),
                slot.maxStudents(),
                slot.currentBookings(),
                slot.remainingSeats(),
                slot.active(),
                slot.createdAt(),
                bookedByMe
        );
    }
}
