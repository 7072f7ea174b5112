package personal.labs.core.slot.domain.model;

import personal.labs.core.slot.domain.exception.InvalidSlotException;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Slot Details Value Object
 * 교사가 직접 편집할 수 있는 실습 세션 속성 (생성/수정 공통)
 */
public record SlotDetails(
        Integer level,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        String topic,
        String description,
        String location,
        Integer maxStudents
) {
    public SlotDetails {
        if (level == null || level < 1) {
            throw new InvalidSlotException("Level must be a positive integer");
        }
        if (date == null) {
            throw new InvalidSlotException("Date cannot be null");
        }
        if (startTime == null || endTime == null) {
            throw new InvalidSlotException("Start time and end time cannot be null");
        }
        if (!endTime.isAfter(startTime)) {
            throw new InvalidSlotException(
                    String.format("End time must be after start time: start=%s, end=%s", startTime, endTime));
        }
        if (topic == null || topic.isBlank()) {
            throw new InvalidSlotException("Topic cannot be null or blank");
        }
        if (location == null || location.isBlank()) {
            throw new InvalidSlotException("Location cannot be null or blank");
        }
        if (maxStudents == null || maxStudents < 1) {
            throw new InvalidSlotException("Max students must be at least 1");
        }
        topic = topic.strip();
        location = location.strip();
        description = (description == null || description.isBlank()) ? null : description.strip();
    }
}
