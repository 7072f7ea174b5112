package personal.labs.core.booking.application.port.in;

import personal.labs.core.booking.domain.model.Booking;

/**
 * Create Booking UseCase (Input Port)
 * 실습 세션 좌석 예약 유스케이스
 */
public interface CreateBookingUseCase {

    /**
     * 좌석 예약
     * 세션 락 안에서 활성 여부, 중복 예약, 정원을 검증한 뒤 인원 증가와 예약 저장을 하나의 트랜잭션으로 처리
     *
     * @param command 예약 커맨드 (studentId, studentName, slotId, notes)
     * @return 생성된 예약 (CONFIRMED)
     * @throws personal.labs.core.slot.domain.exception.SlotNotFoundException 세션이 없을 때
     * @throws personal.labs.core.booking.domain.exception.InactiveSlotException 비활성 세션일 때
     * @throws personal.labs.core.booking.domain.exception.DuplicateBookingException 이미 확정 예약이 있을 때
     * @throws personal.labs.core.booking.domain.exception.SlotFullException 정원이 찼을 때
     */
    Booking createBooking(CreateBookingCommand command);
}
