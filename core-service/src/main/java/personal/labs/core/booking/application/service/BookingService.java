package personal.labs.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import personal.labs.common.exception.BusinessException;
import personal.labs.core.booking.application.port.in.CancelBookingCommand;
import personal.labs.core.booking.application.port.in.CancelBookingUseCase;
import personal.labs.core.booking.application.port.in.CreateBookingCommand;
import personal.labs.core.booking.application.port.in.CreateBookingUseCase;
import personal.labs.core.booking.domain.exception.DuplicateBookingException;
import personal.labs.core.booking.domain.model.Booking;
import personal.labs.core.booking.domain.service.BookingManager;

import java.util.Locale;

/**
 * Booking Application Service
 * 예약 생성/취소 진입점. 트랜잭션은 BookingManager가 담당하고,
 * 여기서는 커밋 시점 제약 위반을 도메인 예외로 변환하고 결과를 기록한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService implements CreateBookingUseCase, CancelBookingUseCase {

    private static final String ACTIVE_BOOKING_CONSTRAINT = "uk_active_slot_student";

    private final BookingManager bookingManager;

    @Override
    public Booking createBooking(CreateBookingCommand command) {
        log.info("Creating booking: studentId={}, slotId={}", command.studentId(), command.slotId());

        try {
            Booking saved = bookingManager.createBookingInTransaction(command);

            log.info("Booking created: bookingId={}, studentId={}, slotId={}",
                    saved.id(), command.studentId(), command.slotId());
            return saved;

        } catch (DataIntegrityViolationException e) {
            if (!isActiveBookingConstraintViolation(e)) {
                log.error("Booking rejected by storage constraint: studentId={}, slotId={}",
                        command.studentId(), command.slotId(), e);
                throw e;
            }
            // 2차 방어: (active_slot_id, student_id) 유니크 인덱스 위반
            log.warn("Duplicate booking rejected by unique index: studentId={}, slotId={}",
                    command.studentId(), command.slotId());
            throw new DuplicateBookingException(command.slotId(), command.studentId());

        } catch (BusinessException e) {
            log.warn("Booking rejected: studentId={}, slotId={}, code={}",
                    command.studentId(), command.slotId(), e.getErrorCode().getCode());
            throw e;
        }
    }

    @Override
    public Booking cancelBooking(CancelBookingCommand command) {
        log.info("Cancelling booking: bookingId={}, studentId={}", command.bookingId(), command.studentId());

        Booking cancelled = bookingManager.cancelBookingInTransaction(command);

        log.info("Booking cancelled: bookingId={}, slotId={}", cancelled.id(), cancelled.slotId());
        return cancelled;
    }

    private boolean isActiveBookingConstraintViolation(DataIntegrityViolationException e) {
        String message = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains(ACTIVE_BOOKING_CONSTRAINT);
    }
}
