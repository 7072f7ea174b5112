package personal.labs.core.slot.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.labs.core.slot.domain.model.Slot;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Slot JPA Entity
 * 실습 세션 테이블 매핑
 */
@Entity
@Table(name = "lab_slots",
        indexes = {
                @Index(name = "idx_slot_level_active_date", columnList = "grade_level, is_active, session_date"),
                @Index(name = "idx_slot_teacher_id", columnList = "teacher_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SlotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "teacher_id", nullable = false)
    private Long teacherId;

    @Column(name = "teacher_name", length = 100)
    private String teacherName;

    @Column(name = "grade_level", nullable = false)
    private int level;

    @Column(name = "session_date", nullable = false)
    private LocalDate date;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(nullable = false, length = 200)
    private String topic;

    @Column(length = 2000)
    private String description;

    @Column(nullable = false, length = 200)
    private String location;

    @Column(name = "max_students", nullable = false)
    private int maxStudents;

    @Column(name = "current_bookings", nullable = false)
    private int currentBookings;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 도메인 모델로부터 엔티티 생성 (신규 저장 및 병합용)
     */
    public static SlotEntity fromDomain(Slot slot) {
        SlotEntity entity = new SlotEntity();
        entity.id = slot.id();
        entity.teacherId = slot.teacherId();
        entity.teacherName = slot.teacherName();
        entity.level = slot.level();
        entity.date = slot.date();
        entity.startTime = slot.startTime();
        entity.endTime = slot.endTime();
        entity.topic = slot.topic();
        entity.description = slot.description();
        entity.location = slot.location();
        entity.maxStudents = slot.maxStudents();
        entity.currentBookings = slot.currentBookings();
        entity.active = slot.active();
        entity.createdAt = slot.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    /**
     * 도메인 모델로 변환
     */
    public Slot toDomain() {
        return new Slot(id, teacherId, teacherName, level, date, startTime, endTime,
                topic, description, location, maxStudents, currentBookings, active, createdAt);
    }
}
