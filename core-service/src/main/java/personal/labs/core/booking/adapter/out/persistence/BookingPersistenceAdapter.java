package personal.labs.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.labs.core.booking.application.port.out.BookingRepository;
import personal.labs.core.booking.domain.model.Booking;
import personal.labs.core.booking.domain.model.BookingStatus;

import java.util.List;
import java.util.Optional;

/**
 * Booking Persistence Adapter
 * JPA를 사용한 예약 원장 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingPersistenceAdapter implements BookingRepository {

    private final JpaBookingRepository jpaBookingRepository;

    @Override
    public Booking save(Booking booking) {
        log.debug("Saving booking: bookingId={}, slotId={}, status={}",
                booking.id(), booking.slotId(), booking.status());
        // 유니크 인덱스 위반을 트랜잭션 안에서 드러내기 위해 즉시 flush
        BookingEntity saved = jpaBookingRepository.saveAndFlush(BookingEntity.fromDomain(booking));
        return saved.toDomain();
    }

    @Override
    public Optional<Booking> findByIdForUpdate(Long bookingId) {
        return jpaBookingRepository.findByIdForUpdate(bookingId)
                .map(BookingEntity::toDomain);
    }

    @Override
    public Optional<Long> findSlotIdById(Long bookingId) {
        return jpaBookingRepository.findSlotIdById(bookingId);
    }

    @Override
    public boolean existsConfirmed(Long slotId, Long studentId) {
        return jpaBookingRepository.existsBySlotIdAndStudentIdAndStatus(slotId, studentId, BookingStatus.CONFIRMED);
    }

    @Override
    public List<Booking> findConfirmedBySlotId(Long slotId) {
        return toDomain(jpaBookingRepository.findBySlotIdAndStatusOrderByCreatedAtAscIdAsc(slotId, BookingStatus.CONFIRMED));
    }

    @Override
    public List<Booking> findByStudentId(Long studentId) {
        return toDomain(jpaBookingRepository.findByStudentIdOrderByCreatedAtDescIdDesc(studentId));
    }

    @Override
    public List<Booking> findAll() {
        return toDomain(jpaBookingRepository.findAllByOrderByCreatedAtDescIdDesc());
    }

    private List<Booking> toDomain(List<BookingEntity> entities) {
        return entities.stream()
                .map(BookingEntity::toDomain)
                .toList();
    }
}
