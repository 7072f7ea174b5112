package personal.labs.core.slot.domain.model;

import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;
import personal.labs.core.slot.domain.exception.SlotAccessDeniedException;
import personal.labs.core.slot.domain.exception.SlotCapacityExceededException;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Slot Domain Model
 * 교사가 공개하는 실습 세션 (불변)
 * 불변식: 0 <= currentBookings <= maxStudents, endTime > startTime
 */
public record Slot(
        Long id,
        Long teacherId,
        String teacherName,
        int level,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        String topic,
        String description,
        String location,
        int maxStudents,
        int currentBookings,
        boolean active,
        LocalDateTime createdAt
) {
    public Slot {
        if (teacherId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Teacher ID cannot be null");
        }
        // 편집 가능 속성 검증은 SlotDetails에 위임
        new SlotDetails(level, date, startTime, endTime, topic, description, location, maxStudents);
        if (currentBookings < 0 || currentBookings > maxStudents) {
            throw new IllegalStateException(String.format(
                    "Booked seats out of range: currentBookings=%d, maxStudents=%d, slotId=%s",
                    currentBookings, maxStudents, id));
        }
    }

    /**
     * 실습 세션 생성 (정적 팩토리 메서드)
     *
     * @param teacherId   담당 교사 ID
     * @param teacherName 담당 교사 표시 이름
     * @param details     세션 속성
     * @return 새로운 세션 (예약 0명, 활성 상태)
     */
    public static Slot create(Long teacherId, String teacherName, SlotDetails details) {
        return new Slot(
                null,
                teacherId,
                teacherName,
                details.level(),
                details.date(),
                details.startTime(),
                details.endTime(),
                details.topic(),
                details.description(),
                details.location(),
                details.maxStudents(),
                0,
                true,
                LocalDateTime.now());
    }

    /**
     * 세션 속성 수정
     * 이미 예약한 학생을 보호하기 위해 정원을 현재 예약 인원보다 줄일 수 없다
     *
     * @throws SlotCapacityExceededException maxStudents < currentBookings 일 때
     */
    public Slot update(SlotDetails details) {
        if (details.maxStudents() < currentBookings) {
            throw new SlotCapacityExceededException(id, details.maxStudents(), currentBookings);
        }
        return new Slot(id, teacherId, teacherName,
                details.level(), details.date(), details.startTime(), details.endTime(),
                details.topic(), details.description(), details.location(), details.maxStudents(),
                currentBookings, active, createdAt);
    }

    /**
     * 학생 노출 여부 변경 (기존 예약에는 영향 없음)
     */
    public Slot changeActive(boolean newActive) {
        return new Slot(id, teacherId, teacherName, level, date, startTime, endTime,
                topic, description, location, maxStudents, currentBookings, newActive, createdAt);
    }

    /**
     * 예약 인원 증가
     *
     * @throws SlotCapacityExceededException 정원을 초과하게 될 때
     */
    public Slot incrementBooked() {
        if (isFull()) {
            throw new SlotCapacityExceededException(id, maxStudents, currentBookings + 1);
        }
        return withCurrentBookings(currentBookings + 1);
    }

    /**
     * 예약 인원 감소 (0 미만으로 내려가지 않음)
     */
    public Slot decrementBooked() {
        return withCurrentBookings(Math.max(0, currentBookings - 1));
    }

    /**
     * 세션 길이 (분) - 시작/종료 시각에서 항상 계산
     */
    public long durationMinutes() {
        return Duration.between(startTime, endTime).toMinutes();
    }

    public int remainingSeats() {
        return maxStudents - currentBookings;
    }

    public boolean isFull() {
        return currentBookings >= maxStudents;
    }

    public boolean isOwnedBy(Long requestTeacherId) {
        return teacherId.equals(requestTeacherId);
    }

    // ========== Domain Validation Methods (Tell, Don't Ask) ==========

    /**
     * 소유권 검증
     *
     * @throws SlotAccessDeniedException 담당 교사가 아닐 때
     */
    public void ensureOwnedBy(Long requestTeacherId) {
        if (!isOwnedBy(requestTeacherId)) {
            throw new SlotAccessDeniedException(id, requestTeacherId);
        }
    }

    private Slot withCurrentBookings(int newCurrentBookings) {
        return new Slot(id, teacherId, teacherName, level, date, startTime, endTime,
                topic, description, location, maxStudents, newCurrentBookings, active, createdAt);
    }
}
