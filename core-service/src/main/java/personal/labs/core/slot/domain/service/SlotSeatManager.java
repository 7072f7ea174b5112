package personal.labs.core.slot.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import personal.labs.core.slot.application.port.out.SlotRepository;
import personal.labs.core.slot.domain.exception.SlotNotFoundException;
import personal.labs.core.slot.domain.model.Slot;

import java.util.Optional;

/**
 * Slot Seat Manager (Domain Service)
 * 세션 예약 인원(currentBookings)을 변경하는 유일한 경로
 * 예약 원장의 트랜잭션 안에서만 호출되며, 세션 행 락으로 같은 세션의 변경을 직렬화한다
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class SlotSeatManager {

    private final SlotRepository slotRepository;

    /**
     * 세션 락 획득
     *
     * @throws SlotNotFoundException 세션이 없을 때
     */
    public Slot lockSlot(Long slotId) {
        return findLocked(slotId).orElseThrow(() -> {
            log.warn("Slot not found for locking: slotId={}", slotId);
            return new SlotNotFoundException(slotId);
        });
    }

    /**
     * 세션 락 획득 (세션이 이미 삭제된 경우 empty)
     */
    public Optional<Slot> tryLockSlot(Long slotId) {
        return findLocked(slotId);
    }

    /**
     * 예약 인원 1 증가
     *
     * @throws personal.labs.core.slot.domain.exception.SlotCapacityExceededException 정원 초과 시
     */
    public Slot incrementBooked(Long slotId) {
        Slot incremented = lockSlot(slotId).incrementBooked();
        Slot saved = slotRepository.save(incremented);
        log.debug("Slot seat taken: slotId={}, currentBookings={}/{}",
                slotId, saved.currentBookings(), saved.maxStudents());
        return saved;
    }

    /**
     * 예약 인원 1 감소 (0 미만으로 내려가지 않음)
     */
    public Slot decrementBooked(Long slotId) {
        Slot current = lockSlot(slotId);
        if (current.currentBookings() == 0) {
            log.warn("Slot seat counter already at zero: slotId={}", slotId);
            return current;
        }
        Slot saved = slotRepository.save(current.decrementBooked());
        log.debug("Slot seat released: slotId={}, currentBookings={}/{}",
                slotId, saved.currentBookings(), saved.maxStudents());
        return saved;
    }

    private Optional<Slot> findLocked(Long slotId) {
        return slotRepository.findByIdForUpdate(slotId);
    }
}
