package personal.labs.core.booking.application.port.in;

import personal.labs.core.booking.domain.model.Booking;

/**
 * Cancel Booking UseCase (Input Port)
 * 예약 취소 유스케이스
 */
public interface CancelBookingUseCase {

    /**
     * 예약 취소
     * 상태 변경(CANCELLED)과 세션 인원 감소를 하나의 트랜잭션으로 처리
     *
     * @param command 취소 커맨드 (bookingId, studentId)
     * @return 취소된 예약
     * @throws personal.labs.core.booking.domain.exception.BookingNotFoundException 예약이 없을 때
     * @throws personal.labs.core.booking.domain.exception.BookingAccessDeniedException 본인 예약이 아닐 때
     * @throws personal.labs.core.booking.domain.exception.BookingAlreadyCancelledException 이미 취소된 예약일 때 (no-op)
     */
    Booking cancelBooking(CancelBookingCommand command);
}
