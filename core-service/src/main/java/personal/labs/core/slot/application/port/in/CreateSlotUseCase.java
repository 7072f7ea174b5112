package personal.labs.core.slot.application.port.in;

import personal.labs.core.slot.domain.model.Slot;

/**
 * Create Slot UseCase (Input Port)
 * 실습 세션 생성 유스케이스
 */
public interface CreateSlotUseCase {

    /**
     * 실습 세션 생성
     * 날짜가 과거인지는 검증하지 않는다 (화면에서 제한)
     *
     * @param command 생성 커맨드 (teacherId, teacherName, details)
     * @return 생성된 세션 (예약 0명, 활성 상태)
     * @throws personal.labs.core.slot.domain.exception.InvalidSlotException 입력값이 불변식을 위반할 때
     */
    Slot createSlot(CreateSlotCommand command);
}
