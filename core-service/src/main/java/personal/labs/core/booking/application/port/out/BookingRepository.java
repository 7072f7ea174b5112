package personal.labs.core.booking.application.port.out;

import personal.labs.core.booking.domain.model.Booking;

import java.util.List;
import java.util.Optional;

/**
 * Booking Repository (Output Port)
 * 예약 저장소 인터페이스
 */
public interface BookingRepository {

    /**
     * 예약 저장
     *
     * @param booking 예약 정보
     * @return 저장된 예약 정보 (ID 포함)
     */
    Booking save(Booking booking);

    /**
     * 예약 행을 비관적 쓰기 락으로 조회
     * 세션 락 이후에 호출해 락 순서(세션 → 예약)를 유지한다
     */
    Optional<Booking> findByIdForUpdate(Long bookingId);

    /**
     * 예약이 가리키는 세션 ID만 조회 (엔티티를 영속성 컨텍스트에 올리지 않음)
     * 세션 락을 잡기 전에 어떤 세션을 잠글지 결정하는 용도
     */
    Optional<Long> findSlotIdById(Long bookingId);

    boolean existsConfirmed(Long slotId, Long studentId);

    /**
     * 세션의 확정 예약 (생성 시각 오름차순)
     */
    List<Booking> findConfirmedBySlotId(Long slotId);

    /**
     * 학생의 모든 예약 (생성 시각 내림차순)
     */
    List<Booking> findByStudentId(Long studentId);

    List<Booking> findAll();
}
