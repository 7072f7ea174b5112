package personal.labs.core.slot.adapter.in.web.dto;

/**
 * 실습 세션 삭제 응답 DTO
 */
public record DeleteSlotResponse(
        Long slotId,
        int cancelledBookings
) {
}
