package personal.labs.core.slot.application.port.in;

import personal.labs.core.slot.domain.model.Slot;

/**
 * Update Slot UseCase (Input Port)
 * 실습 세션 수정 유스케이스
 */
public interface UpdateSlotUseCase {

    /**
     * 실습 세션 수정
     *
     * @param command 수정 커맨드
     * @return 수정된 세션
     * @throws personal.labs.core.slot.domain.exception.SlotNotFoundException 세션이 없을 때
     * @throws personal.labs.core.slot.domain.exception.SlotAccessDeniedException 담당 교사가 아닐 때
     * @throws personal.labs.core.slot.domain.exception.SlotCapacityExceededException 정원을 현재 예약 인원보다 줄일 때
     */
    Slot updateSlot(UpdateSlotCommand command);
}
