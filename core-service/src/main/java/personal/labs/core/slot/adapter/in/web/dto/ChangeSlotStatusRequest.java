package personal.labs.core.slot.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;

/**
 * 실습 세션 활성/비활성 전환 요청 DTO
 */
public record ChangeSlotStatusRequest(
        @NotNull(message = "활성 여부는 필수입니다.")
        Boolean active
) {
}
