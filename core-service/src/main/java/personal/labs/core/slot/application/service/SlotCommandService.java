package personal.labs.core.slot.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;
import personal.labs.core.slot.application.port.in.ChangeSlotStatusUseCase;
import personal.labs.core.slot.application.port.in.CreateSlotCommand;
import personal.labs.core.slot.application.port.in.CreateSlotUseCase;
import personal.labs.core.slot.application.port.in.DeleteSlotUseCase;
import personal.labs.core.slot.application.port.in.UpdateSlotCommand;
import personal.labs.core.slot.application.port.in.UpdateSlotUseCase;
import personal.labs.core.slot.application.port.out.ActiveBookingCancellationPort;
import personal.labs.core.slot.application.port.out.SlotRepository;
import personal.labs.core.slot.domain.exception.SlotNotFoundException;
import personal.labs.core.slot.domain.model.Slot;

/**
 * Slot Command Service (SRP)
 * 단일 책임: 실습 세션 생성/수정/상태 변경/삭제
 * 기존 세션을 변경하는 작업은 세션 행 락을 잡고 수행하여 예약 인원 변경과 직렬화한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(isolation = Isolation.READ_COMMITTED)
public class SlotCommandService implements
        CreateSlotUseCase,
        UpdateSlotUseCase,
        ChangeSlotStatusUseCase,
        DeleteSlotUseCase {

    private final SlotRepository slotRepository;
    private final ActiveBookingCancellationPort activeBookingCancellationPort;

    @Override
    public Slot createSlot(CreateSlotCommand command) {
        Slot saved = slotRepository.save(
                Slot.create(command.teacherId(), command.teacherName(), command.details()));

        log.info("Slot created: slotId={}, teacherId={}, level={}, date={}, maxStudents={}",
                saved.id(), saved.teacherId(), saved.level(), saved.date(), saved.maxStudents());
        return saved;
    }

    @Override
    public Slot updateSlot(UpdateSlotCommand command) {
        Slot slot = loadLocked(command.slotId());
        slot.ensureOwnedBy(command.teacherId());

        Slot saved = slotRepository.save(slot.update(command.details()));

        log.info("Slot updated: slotId={}, teacherId={}, maxStudents={}, currentBookings={}",
                saved.id(), saved.teacherId(), saved.maxStudents(), saved.currentBookings());
        return saved;
    }

    @Override
    public Slot changeStatus(Long slotId, Long teacherId, boolean active) {
        Slot slot = loadLocked(slotId);
        slot.ensureOwnedBy(teacherId);

        if (slot.active() == active) {
            log.debug("Slot status unchanged: slotId={}, active={}", slotId, active);
            return slot;
        }

        Slot saved = slotRepository.save(slot.changeActive(active));
        log.info("Slot status changed: slotId={}, active={}", slotId, active);
        return saved;
    }

    @Override
    public int deleteSlot(Long slotId, Long teacherId) {
        Slot slot = loadLocked(slotId);
        slot.ensureOwnedBy(teacherId);

        int cancelled = activeBookingCancellationPort.cancelActiveBookings(slotId);
        slotRepository.deleteById(slotId);

        log.info("Slot deleted: slotId={}, teacherId={}, cancelledBookings={}", slotId, teacherId, cancelled);
        return cancelled;
    }

    private Slot loadLocked(Long slotId) {
        return slotRepository.findByIdForUpdate(slotId)
                .orElseThrow(() -> {
                    log.warn("Slot not found: slotId={}", slotId);
                    return new SlotNotFoundException(slotId);
                });
    }
}
