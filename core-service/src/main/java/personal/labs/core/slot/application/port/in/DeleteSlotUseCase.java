package personal.labs.core.slot.application.port.in;

/**
 * Delete Slot UseCase (Input Port)
 * 실습 세션 삭제 유스케이스
 */
public interface DeleteSlotUseCase {

    /**
     * 실습 세션 삭제
     * 확정된 예약은 같은 트랜잭션 안에서 모두 취소된 뒤 세션이 삭제된다
     *
     * @param slotId    세션 ID
     * @param teacherId 요청 교사 ID
     * @return 함께 취소된 예약 수
     */
    int deleteSlot(Long slotId, Long teacherId);
}
