package personal.labs.core.slot.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.labs.core.slot.application.port.in.UpdateSlotCommand;
import personal.labs.core.slot.domain.model.SlotDetails;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 실습 세션 수정 요청 DTO (편집 가능한 속성 전체 교체)
 */
public record UpdateSlotRequest(
        @NotNull(message = "레벨은 필수입니다.")
        @Min(value = 1, message = "레벨은 1 이상이어야 합니다.")
        Integer level,

        @NotNull(message = "날짜는 필수입니다.")
        LocalDate date,

        @NotNull(message = "시작 시각은 필수입니다.")
        @JsonFormat(pattern = "HH:mm")
        LocalTime startTime,

        @NotNull(message = "종료 시각은 필수입니다.")
        @JsonFormat(pattern = "HH:mm")
        LocalTime endTime,

        @NotBlank(message = "주제는 필수입니다.")
        @Size(max = 200, message = "주제는 200자 이하여야 합니다.")
        String topic,

        @Size(max = 2000, message = "설명은 2000자 이하여야 합니다.")
        String description,

        @NotBlank(message = "장소는 필수입니다.")
        @Size(max = 200, message = "장소는 200자 이하여야 합니다.")
        String location,

        @NotNull(message = "정원은 필수입니다.")
        @Min(value = 1, message = "정원은 1명 이상이어야 합니다.")
        Integer maxStudents
) {
    public UpdateSlotCommand toCommand(Long slotId, Long teacherId) {
        return new UpdateSlotCommand(slotId, teacherId,
                new SlotDetails(level, date, startTime, endTime, topic, description, location, maxStudents));
    }
}
