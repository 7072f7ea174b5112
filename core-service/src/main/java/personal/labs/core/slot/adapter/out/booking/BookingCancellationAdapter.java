package personal.labs.core.slot.adapter.out.booking;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.labs.core.booking.application.port.out.BookingRepository;
import personal.labs.core.booking.domain.model.Booking;
import personal.labs.core.slot.application.port.out.ActiveBookingCancellationPort;

import java.util.List;

/**
 * Booking Cancellation Adapter
 * 세션 삭제 시 예약 원장의 확정 예약을 취소 상태로 변경
 * 취소 기록은 남겨 학생 예약 이력에서 조회 가능하다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingCancellationAdapter implements ActiveBookingCancellationPort {

    private final BookingRepository bookingRepository;

    @Override
    public int cancelActiveBookings(Long slotId) {
        List<Booking> confirmed = bookingRepository.findConfirmedBySlotId(slotId);
        confirmed.forEach(booking -> bookingRepository.save(booking.cancel()));

        if (!confirmed.isEmpty()) {
            log.info("Cancelled bookings of removed slot: slotId={}, count={}", slotId, confirmed.size());
        }
        return confirmed.size();
    }
}
