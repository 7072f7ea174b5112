package personal.labs.core.slot.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;
import personal.labs.core.booking.application.port.in.GetBookingUseCase;
import personal.labs.core.identity.application.port.in.AuthenticateCallerUseCase;
import personal.labs.core.identity.domain.model.CallerIdentity;
import personal.labs.core.identity.domain.model.CallerRole;
import personal.labs.core.slot.adapter.in.web.dto.ChangeSlotStatusRequest;
import personal.labs.core.slot.adapter.in.web.dto.CreateSlotRequest;
import personal.labs.core.slot.adapter.in.web.dto.DeleteSlotResponse;
import personal.labs.core.slot.adapter.in.web.dto.SlotResponse;
import personal.labs.core.slot.adapter.in.web.dto.UpdateSlotRequest;
import personal.labs.core.slot.application.port.in.ChangeSlotStatusUseCase;
import personal.labs.core.slot.application.port.in.CreateSlotUseCase;
import personal.labs.core.slot.application.port.in.DeleteSlotUseCase;
import personal.labs.core.slot.application.port.in.GetSlotUseCase;
import personal.labs.core.slot.application.port.in.UpdateSlotUseCase;
import personal.labs.core.slot.domain.model.Slot;

import java.util.List;
import java.util.Set;

/**
 * Slot API Controller
 * 실습 세션 등록/관리 및 예약 가능 세션 조회 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/lab")
@RequiredArgsConstructor
public class SlotController {

    private static final String AUTH_HEADER = "X-Auth-Token";

    private final AuthenticateCallerUseCase authenticateCallerUseCase;
    private final CreateSlotUseCase createSlotUseCase;
    private final UpdateSlotUseCase updateSlotUseCase;
    private final ChangeSlotStatusUseCase changeSlotStatusUseCase;
    private final DeleteSlotUseCase deleteSlotUseCase;
    private final GetSlotUseCase getSlotUseCase;
    private final GetBookingUseCase getBookingUseCase;

    /**
     * 실습 세션 생성
     * POST /api/v1/lab/slots
     */
    @PostMapping("/slots")
    public ResponseEntity<SlotResponse> createSlot(
            @Valid @RequestBody CreateSlotRequest request,
            @RequestHeader(AUTH_HEADER) String authToken
    ) {
        CallerIdentity teacher = authenticateCallerUseCase.requireRole(authToken, CallerRole.TEACHER);
        log.info("Create slot: teacherId={}, level={}, date={}", teacher.userId(), request.level(), request.date());

        Slot slot = createSlotUseCase.createSlot(request.toCommand(teacher.userId(), teacher.name()));

        return ResponseEntity.status(HttpStatus.CREATED).body(SlotResponse.from(slot));
    }

    /**
     * 실습 세션 수정
     * PUT /api/v1/lab/slots/{slotId}
     */
    @PutMapping("/slots/{slotId}")
    public ResponseEntity<SlotResponse> updateSlot(
            @PathVariable Long slotId,
            @Valid @RequestBody UpdateSlotRequest request,
            @RequestHeader(AUTH_HEADER) String authToken
    ) {
        CallerIdentity teacher = authenticateCallerUseCase.requireRole(authToken, CallerRole.TEACHER);
        log.info("Update slot: slotId={}, teacherId={}", slotId, teacher.userId());

        Slot slot = updateSlotUseCase.updateSlot(request.toCommand(slotId, teacher.userId()));

        return ResponseEntity.ok(SlotResponse.from(slot));
    }

    /**
     * 실습 세션 활성/비활성 전환
     * PATCH /api/v1/lab/slots/{slotId}/status
     */
    @PatchMapping("/slots/{slotId}/status")
    public ResponseEntity<SlotResponse> changeStatus(
            @PathVariable Long slotId,
            @Valid @RequestBody ChangeSlotStatusRequest request,
            @RequestHeader(AUTH_HEADER) String authToken
    ) {
        CallerIdentity teacher = authenticateCallerUseCase.requireRole(authToken, CallerRole.TEACHER);
        log.info("Change slot status: slotId={}, teacherId={}, active={}", slotId, teacher.userId(), request.active());

        Slot slot = changeSlotStatusUseCase.changeStatus(slotId, teacher.userId(), request.active());

        return ResponseEntity.ok(SlotResponse.from(slot));
    }

    /**
     * 실습 세션 삭제 (확정 예약은 함께 취소)
     * DELETE /api/v1/lab/slots/{slotId}
     */
    @DeleteMapping("/slots/{slotId}")
    public ResponseEntity<DeleteSlotResponse> deleteSlot(
            @PathVariable Long slotId,
            @RequestHeader(AUTH_HEADER) String authToken
    ) {
        CallerIdentity teacher = authenticateCallerUseCase.requireRole(authToken, CallerRole.TEACHER);
        log.info("Delete slot: slotId={}, teacherId={}", slotId, teacher.userId());

        int cancelled = deleteSlotUseCase.deleteSlot(slotId, teacher.userId());

        return ResponseEntity.ok(new DeleteSlotResponse(slotId, cancelled));
    }

    /**
     * 실습 세션 단건 조회
     * GET /api/v1/lab/slots/{slotId}
     */
    @GetMapping("/slots/{slotId}")
    public ResponseEntity<SlotResponse> getSlot(
            @PathVariable Long slotId,
            @RequestHeader(AUTH_HEADER) String authToken
    ) {
        authenticateCallerUseCase.authenticate(authToken);
        return ResponseEntity.ok(SlotResponse.from(getSlotUseCase.getSlot(slotId)));
    }

    /**
     * 예약 가능한 세션 목록 조회
     * GET /api/v1/lab/slots/available?level={level}
     * 학생은 본인 레벨로 고정되고, 교사/관리자는 level 파라미터가 필요하다
     * 학생 응답에는 이미 예약한 세션인지(bookedByMe) 표시한다
     */
    @GetMapping("/slots/available")
    public ResponseEntity<List<SlotResponse>> getAvailableSlots(
            @RequestParam(required = false) Integer level,
            @RequestHeader(AUTH_HEADER) String authToken
    ) {
        CallerIdentity caller = authenticateCallerUseCase.authenticate(authToken);
        int targetLevel = resolveLevel(caller, level);
        log.debug("Get available slots: userId={}, level={}", caller.userId(), targetLevel);

        List<Slot> slots = getSlotUseCase.getAvailableSlots(targetLevel);
        if (!caller.isStudent()) {
            return ResponseEntity.ok(toResponses(slots));
        }

        Set<Long> bookedSlotIds = getBookingUseCase.getBookedSlotIds(caller.userId());
        return ResponseEntity.ok(slots.stream()
                .map(slot -> SlotResponse.from(slot, bookedSlotIds.contains(slot.id())))
                .toList());
    }

    /**
     * 교사 본인 세션 목록
     * GET /api/v1/lab/teachers/me/slots
     */
    @GetMapping("/teachers/me/slots")
    public ResponseEntity<List<SlotResponse>> getMySlots(
            @RequestHeader(AUTH_HEADER) String authToken
    ) {
        CallerIdentity teacher = authenticateCallerUseCase.requireRole(authToken, CallerRole.TEACHER);
        return ResponseEntity.ok(toResponses(getSlotUseCase.getTeacherSlots(teacher.userId())));
    }

    /**
     * 관리자 전체 세션 목록
     * GET /api/v1/lab/admin/slots
     */
    @GetMapping("/admin/slots")
    public ResponseEntity<List<SlotResponse>> getAllSlots(
            @RequestHeader(AUTH_HEADER) String authToken
    ) {
        authenticateCallerUseCase.requireRole(authToken, CallerRole.ADMIN);
        return ResponseEntity.ok(toResponses(getSlotUseCase.getAllSlots()));
    }

    private int resolveLevel(CallerIdentity caller, Integer requestedLevel) {
        if (caller.isStudent()) {
            return caller.level();
        }
        if (requestedLevel == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Level parameter is required for non-student callers");
        }
        return requestedLevel;
    }

    private List<SlotResponse> toResponses(List<Slot> slots) {
        return slots.stream()
                .map(SlotResponse::from)
                .toList();
    }
}
