package personal.labs.core.slot.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Slot
 */
public interface JpaSlotRepository extends JpaRepository<SlotEntity, Long> {

    /**
     * 세션 행 비관적 쓰기 락 (SELECT ... FOR UPDATE)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SlotEntity s WHERE s.id = :id")
    Optional<SlotEntity> findByIdForUpdate(@Param("id") Long id);

    /**
     * 레벨별 예약 가능 세션 목록 조회
     */
    @Query("SELECT s FROM SlotEntity s "
            + "WHERE s.level = :level AND s.active = true AND s.currentBookings < s.maxStudents "
            + "ORDER BY s.date ASC, s.startTime ASC, s.id ASC")
    List<SlotEntity> findAvailableByLevel(@Param("level") int level);

    List<SlotEntity> findByTeacherIdOrderByDateAscStartTimeAscIdAsc(Long teacherId);

    List<SlotEntity> findAllByOrderByDateAscStartTimeAscIdAsc();

    List<SlotEntity> findByIdIn(List<Long> ids);
}
