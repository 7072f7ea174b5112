package personal.labs.core.slot.application.port.out;

/**
 * Active Booking Cancellation Port
 * 세션 삭제 시 확정된 예약을 함께 취소하는 책임
 */
public interface ActiveBookingCancellationPort {

    /**
     * 세션에 걸린 확정 예약을 모두 취소 상태로 변경
     * 호출자의 트랜잭션(세션 락 보유 중) 안에서 실행되어야 한다
     *
     * @param slotId 세션 ID
     * @return 취소된 예약 수
     */
    int cancelActiveBookings(Long slotId);
}
