package personal.labs.core.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.labs.core.booking.adapter.in.web.dto.BookingResponse;
import personal.labs.core.booking.adapter.in.web.dto.CreateBookingRequest;
import personal.labs.core.booking.adapter.in.web.dto.RosterEntryResponse;
import personal.labs.core.booking.adapter.in.web.dto.StudentBookingResponse;
import personal.labs.core.booking.application.port.in.CancelBookingCommand;
import personal.labs.core.booking.application.port.in.CancelBookingUseCase;
import personal.labs.core.booking.application.port.in.CreateBookingUseCase;
import personal.labs.core.booking.application.port.in.GetBookingUseCase;
import personal.labs.core.booking.domain.model.Booking;
import personal.labs.core.identity.application.port.in.AuthenticateCallerUseCase;
import personal.labs.core.identity.domain.model.CallerIdentity;
import personal.labs.core.identity.domain.model.CallerRole;

import java.util.List;

/**
 * Booking API Controller
 * 좌석 예약/취소 및 예약 이력, 세션 명단 조회 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/lab")
@RequiredArgsConstructor
public class BookingController {

    private static final String AUTH_HEADER = "X-Auth-Token";

    private final AuthenticateCallerUseCase authenticateCallerUseCase;
    private final CreateBookingUseCase createBookingUseCase;
    private final CancelBookingUseCase cancelBookingUseCase;
    private final GetBookingUseCase getBookingUseCase;

    /**
     * 좌석 예약 생성
     * POST /api/v1/lab/bookings
     */
    @PostMapping("/bookings")
    public ResponseEntity<BookingResponse> createBooking(
            @Valid @RequestBody CreateBookingRequest request,
            @RequestHeader(AUTH_HEADER) String authToken
    ) {
        CallerIdentity student = authenticateCallerUseCase.requireRole(authToken, CallerRole.STUDENT);
        log.info("Create booking: studentId={}, slotId={}", student.userId(), request.slotId());

        Booking booking = createBookingUseCase.createBooking(request.toCommand(student.userId(), student.name()));

        return ResponseEntity.status(HttpStatus.CREATED).body(BookingResponse.from(booking));
    }

    /**
     * 예약 취소
     * DELETE /api/v1/lab/bookings/{bookingId}
     * 이미 취소된 예약이면 200 과 함께 B006 코드를 반환한다
     */
    @DeleteMapping("/bookings/{bookingId}")
    public ResponseEntity<BookingResponse> cancelBooking(
            @PathVariable Long bookingId,
            @RequestHeader(AUTH_HEADER) String authToken
    ) {
        CallerIdentity student = authenticateCallerUseCase.requireRole(authToken, CallerRole.STUDENT);
        log.info("Cancel booking: bookingId={}, studentId={}", bookingId, student.userId());

        Booking booking = cancelBookingUseCase.cancelBooking(new CancelBookingCommand(bookingId, student.userId()));

        return ResponseEntity.ok(BookingResponse.from(booking));
    }

    /**
     * 학생 본인 예약 이력 (모든 상태, 최신순)
     * GET /api/v1/lab/bookings/me
     */
    @GetMapping("/bookings/me")
    public ResponseEntity<List<StudentBookingResponse>> getMyBookings(
            @RequestHeader(AUTH_HEADER) String authToken
    ) {
        CallerIdentity student = authenticateCallerUseCase.requireRole(authToken, CallerRole.STUDENT);

        List<StudentBookingResponse> response = getBookingUseCase.getStudentBookings(student.userId()).stream()
                .map(StudentBookingResponse::from)
                .toList();

        return ResponseEntity.ok(response);
    }

    /**
     * 세션 명단 (확정 예약, 먼저 예약한 순)
     * GET /api/v1/lab/slots/{slotId}/bookings
     */
    @GetMapping("/slots/{slotId}/bookings")
    public ResponseEntity<List<RosterEntryResponse>> getRoster(
            @PathVariable Long slotId,
            @RequestHeader(AUTH_HEADER) String authToken
    ) {
        CallerIdentity caller = authenticateCallerUseCase.requireRole(authToken, CallerRole.TEACHER, CallerRole.ADMIN);

        List<Booking> roster = caller.isAdmin()
                ? getBookingUseCase.getRoster(slotId)
                : getBookingUseCase.getRosterForTeacher(slotId, caller.userId());

        return ResponseEntity.ok(roster.stream()
                .map(RosterEntryResponse::from)
                .toList());
    }

    /**
     * 관리자 전체 예약 목록
     * GET /api/v1/lab/admin/bookings
     */
    @GetMapping("/admin/bookings")
    public ResponseEntity<List<BookingResponse>> getAllBookings(
            @RequestHeader(AUTH_HEADER) String authToken
    ) {
        authenticateCallerUseCase.requireRole(authToken, CallerRole.ADMIN);

        return ResponseEntity.ok(getBookingUseCase.getAllBookings().stream()
                .map(BookingResponse::from)
                .toList());
    }
}
