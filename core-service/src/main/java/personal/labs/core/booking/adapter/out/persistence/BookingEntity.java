package personal.labs.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.labs.core.booking.domain.model.Booking;
import personal.labs.core.booking.domain.model.BookingStatus;

import java.time.LocalDateTime;

/**
 * Booking JPA Entity
 * 예약 원장 테이블 매핑
 * active_slot_id는 CONFIRMED 일 때만 slot_id 값을 가지며, 취소되면 NULL이 된다.
 * (active_slot_id, student_id) 유니크 인덱스로 학생당 세션별 확정 예약은 하나로 제한된다
 */
@Entity
@Table(name = "lab_bookings",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_active_slot_student", columnNames = {"active_slot_id", "student_id"})
        },
        indexes = {
                @Index(name = "idx_booking_slot_status", columnList = "slot_id, status"),
                @Index(name = "idx_booking_student_id", columnList = "student_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "slot_id", nullable = false)
    private Long slotId;

    @Column(name = "active_slot_id")
    private Long activeSlotId;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Column(name = "student_name", length = 100)
    private String studentName;

    @Column(length = Booking.MAX_NOTES_LENGTH)
    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    public static BookingEntity fromDomain(Booking booking) {
        BookingEntity entity = new BookingEntity();
        entity.id = booking.id();
        entity.slotId = booking.slotId();
        entity.activeSlotId = booking.isConfirmed() ? booking.slotId() : null;
        entity.studentId = booking.studentId();
        entity.studentName = booking.studentName();
        entity.notes = booking.notes();
        entity.status = booking.status();
        entity.createdAt = booking.createdAt();
        entity.cancelledAt = booking.cancelledAt();
        return entity;
    }

    public Booking toDomain() {
        return new Booking(id, slotId, studentId, studentName, notes, status, createdAt, cancelledAt);
    }
}
