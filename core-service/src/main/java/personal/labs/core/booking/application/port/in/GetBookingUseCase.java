package personal.labs.core.booking.application.port.in;

import personal.labs.core.booking.domain.model.Booking;

import java.util.List;
import java.util.Set;

/**
 * Get Booking UseCase (Input Port)
 * 예약 이력 및 명단 조회 유스케이스
 */
public interface GetBookingUseCase {

    /**
     * 학생 예약 이력 (모든 상태, 최신순)
     * 확정/취소 구분은 호출 측에서 처리
     */
    List<StudentBookingView> getStudentBookings(Long studentId);

    /**
     * 담당 교사용 세션 명단 (확정 예약만, 먼저 예약한 순)
     *
     * @throws personal.labs.core.slot.domain.exception.SlotNotFoundException 세션이 없을 때
     * @throws personal.labs.core.slot.domain.exception.SlotAccessDeniedException 담당 교사가 아닐 때
     */
    List<Booking> getRosterForTeacher(Long slotId, Long teacherId);

    /**
     * 관리자용 세션 명단 (소유권 검증 없음)
     */
    List<Booking> getRoster(Long slotId);

    /**
     * 관리자용 전체 예약 목록
     */
    List<Booking> getAllBookings();

    /**
     * 학생이 확정 예약을 가지고 있는 세션 ID
     * 예약 가능 목록에서 이미 예약한 세션을 표시하는 용도
     */
    Set<Long> getBookedSlotIds(Long studentId);
}
