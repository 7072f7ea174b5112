package personal.labs.core.slot.application.port.in;

import personal.labs.core.slot.domain.model.Slot;

/**
 * Change Slot Status UseCase (Input Port)
 * 실습 세션 활성/비활성 전환
 */
public interface ChangeSlotStatusUseCase {

    Slot changeStatus(Long slotId, Long teacherId, boolean active);
}
