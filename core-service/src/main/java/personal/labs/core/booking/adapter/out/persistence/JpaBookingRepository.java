package personal.labs.core.booking.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.labs.core.booking.domain.model.BookingStatus;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Booking
 */
public interface JpaBookingRepository extends JpaRepository<BookingEntity, Long> {

    @Query("SELECT b.slotId FROM BookingEntity b WHERE b.id = :id")
    Optional<Long> findSlotIdById(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BookingEntity b WHERE b.id = :id")
    Optional<BookingEntity> findByIdForUpdate(@Param("id") Long id);

    boolean existsBySlotIdAndStudentIdAndStatus(Long slotId, Long studentId, BookingStatus status);

    List<BookingEntity> findBySlotIdAndStatusOrderByCreatedAtAscIdAsc(Long slotId, BookingStatus status);

    List<BookingEntity> findByStudentIdOrderByCreatedAtDescIdDesc(Long studentId);

    List<BookingEntity> findAllByOrderByCreatedAtDescIdDesc();
}
