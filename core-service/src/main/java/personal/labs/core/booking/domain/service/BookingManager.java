package personal.labs.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;
import personal.labs.core.booking.application.port.in.CancelBookingCommand;
import personal.labs.core.booking.application.port.in.CreateBookingCommand;
import personal.labs.core.booking.application.port.out.BookingRepository;
import personal.labs.core.booking.domain.exception.BookingNotFoundException;
import personal.labs.core.booking.domain.exception.DuplicateBookingException;
import personal.labs.core.booking.domain.exception.InactiveSlotException;
import personal.labs.core.booking.domain.exception.SlotFullException;
import personal.labs.core.booking.domain.model.Booking;
import personal.labs.core.slot.domain.exception.SlotCapacityExceededException;
import personal.labs.core.slot.domain.model.Slot;
import personal.labs.core.slot.domain.service.SlotSeatManager;

/**
 * Booking Domain Service (Transaction Manager)
 * 예약 원장의 트랜잭션 경계
 * 모든 좌석 변경은 세션 행 락을 먼저 잡은 뒤 수행하므로, 같은 세션에 대한 예약/취소는 직렬화되고
 * 서로 다른 세션은 병렬로 진행된다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingManager {

    private final SlotSeatManager slotSeatManager;
    private final BookingRepository bookingRepository;

    /**
     * 트랜잭션 내에서 좌석 확보 및 예약 저장
     * 1. 세션 락 + 존재/활성 검증
     * 2. 학생의 확정 예약 중복 검증
     * 3. 세션 인원 증가 (정원 초과 시 실패)
     * 4. 예약 저장 (CONFIRMED)
     * 3, 4 중 하나라도 실패하면 전체 롤백되어 인원과 예약 기록이 어긋나지 않는다
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public Booking createBookingInTransaction(CreateBookingCommand command) {
        Slot slot = slotSeatManager.lockSlot(command.slotId());
        if (!slot.active()) {
            throw new InactiveSlotException(slot.id());
        }

        if (bookingRepository.existsConfirmed(command.slotId(), command.studentId())) {
            throw new DuplicateBookingException(command.slotId(), command.studentId());
        }

        try {
            slotSeatManager.incrementBooked(command.slotId());
        } catch (SlotCapacityExceededException e) {
            throw new SlotFullException(command.slotId(), e);
        }

        Booking booking = Booking.create(
                command.slotId(),
                command.studentId(),
                command.studentName(),
                command.notes());

        return bookingRepository.save(booking);
    }

    /**
     * 트랜잭션 내에서 예약 취소 및 좌석 반환
     * 세션 락을 잡은 뒤 예약 행도 잠그고 읽으므로, 락을 기다린 쪽은 항상 마지막으로 커밋된 상태를 본다
     * 동시에 들어온 중복 취소나 세션 삭제와 겹친 취소는 B006 으로 끝난다
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public Booking cancelBookingInTransaction(CancelBookingCommand command) {
        Long slotId = bookingRepository.findSlotIdById(command.bookingId())
                .orElseThrow(() -> new BookingNotFoundException(command.bookingId()));

        // 세션이 이미 삭제된 경우에는 그 예약도 함께 취소되어 있으므로 락 대상이 없다
        boolean slotExists = slotSeatManager.tryLockSlot(slotId).isPresent();

        Booking booking = bookingRepository.findByIdForUpdate(command.bookingId())
                .orElseThrow(() -> new BookingNotFoundException(command.bookingId()));

        booking.ensureOwnership(command.studentId());
        booking.ensureConfirmed();

        Booking cancelled = bookingRepository.save(booking.cancel());
        if (slotExists) {
            slotSeatManager.decrementBooked(slotId);
        } else {
            log.warn("Confirmed booking without slot: bookingId={}, slotId={}", booking.id(), slotId);
        }
        return cancelled;
    }
}
