package personal.labs.core.slot.application.port.in;

import personal.labs.core.slot.domain.model.Slot;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Get Slot UseCase (Input Port)
 * 실습 세션 조회 유스케이스
 */
public interface GetSlotUseCase {

    /**
     * @throws personal.labs.core.slot.domain.exception.SlotNotFoundException 세션이 없을 때
     */
    Slot getSlot(Long slotId);

    /**
     * 학생에게 노출할 예약 가능 세션 목록
     * 레벨 일치 + 활성 + 잔여석 있음, 날짜/시작 시각 오름차순
     * 예약/취소마다 잔여석이 바뀌므로 캐시하지 않고 매번 조회한다
     *
     * @param level 학생 레벨
     */
    List<Slot> getAvailableSlots(int level);

    List<Slot> getTeacherSlots(Long teacherId);

    List<Slot> getAllSlots();

    /**
     * 여러 세션을 한 번에 조회 (존재하는 세션만 포함)
     */
    Map<Long, Slot> getSlotsByIds(Collection<Long> slotIds);
}
