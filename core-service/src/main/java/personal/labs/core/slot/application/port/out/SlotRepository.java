package personal.labs.core.slot.application.port.out;

import personal.labs.core.slot.domain.model.Slot;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Slot Repository (Output Port)
 * 실습 세션 저장소 인터페이스
 */
public interface SlotRepository {

    Optional<Slot> findById(Long slotId);

    /**
     * 세션 행에 쓰기 락을 걸고 조회
     * 같은 세션의 예약 인원 변경은 이 락으로 직렬화된다 (트랜잭션 안에서만 호출)
     *
     * @param slotId 세션 ID
     * @return 락이 걸린 세션
     */
    Optional<Slot> findByIdForUpdate(Long slotId);

    /**
     * 레벨이 일치하고, 활성이며, 잔여석이 있는 세션 (날짜/시작 시각 오름차순)
     */
    List<Slot> findAvailableByLevel(int level);

    List<Slot> findByTeacherId(Long teacherId);

    List<Slot> findAll();

    List<Slot> findAllByIds(Collection<Long> slotIds);

    Slot save(Slot slot);

    void deleteById(Long slotId);
}
