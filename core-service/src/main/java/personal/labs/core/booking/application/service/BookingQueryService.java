package personal.labs.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.labs.core.booking.application.port.in.GetBookingUseCase;
import personal.labs.core.booking.application.port.in.StudentBookingView;
import personal.labs.core.booking.application.port.out.BookingRepository;
import personal.labs.core.booking.domain.model.Booking;
import personal.labs.core.slot.application.port.in.GetSlotUseCase;
import personal.labs.core.slot.domain.model.Slot;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Booking Query Service (SRP)
 * 단일 책임: 예약 이력 및 세션 명단 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BookingQueryService implements GetBookingUseCase {

    private final BookingRepository bookingRepository;
    private final GetSlotUseCase getSlotUseCase;

    @Override
    public List<StudentBookingView> getStudentBookings(Long studentId) {
        List<Booking> bookings = bookingRepository.findByStudentId(studentId);

        Set<Long> slotIds = bookings.stream()
                .map(Booking::slotId)
                .collect(Collectors.toSet());
        Map<Long, Slot> slots = getSlotUseCase.getSlotsByIds(slotIds);

        log.debug("Found {} bookings for student: {}", bookings.size(), studentId);
        return bookings.stream()
                .map(booking -> new StudentBookingView(booking, slots.get(booking.slotId())))
                .toList();
    }

    @Override
    public List<Booking> getRosterForTeacher(Long slotId, Long teacherId) {
        Slot slot = getSlotUseCase.getSlot(slotId);
        slot.ensureOwnedBy(teacherId);
        return bookingRepository.findConfirmedBySlotId(slotId);
    }

    @Override
    public List<Booking> getRoster(Long slotId) {
        getSlotUseCase.getSlot(slotId);
        return bookingRepository.findConfirmedBySlotId(slotId);
    }

    @Override
    public List<Booking> getAllBookings() {
        return bookingRepository.findAll();
    }

    @Override
    public Set<Long> getBookedSlotIds(Long studentId) {
        return bookingRepository.findByStudentId(studentId).stream()
                .filter(Booking::isConfirmed)
                .map(Booking::slotId)
                .collect(Collectors.toSet());
    }
}
