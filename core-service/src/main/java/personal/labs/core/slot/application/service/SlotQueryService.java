package personal.labs.core.slot.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.labs.common.exception.BusinessException;
import personal.labs.common.exception.ErrorCode;
import personal.labs.core.slot.application.port.in.GetSlotUseCase;
import personal.labs.core.slot.application.port.out.SlotRepository;
import personal.labs.core.slot.domain.exception.SlotNotFoundException;
import personal.labs.core.slot.domain.model.Slot;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Slot Query Service (SRP)
 * 단일 책임: 실습 세션 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SlotQueryService implements GetSlotUseCase {

    private final SlotRepository slotRepository;

    @Override
    public Slot getSlot(Long slotId) {
        return slotRepository.findById(slotId)
                .orElseThrow(() -> {
                    log.warn("Slot not found: slotId={}", slotId);
                    return new SlotNotFoundException(slotId);
                });
    }

    @Override
    public List<Slot> getAvailableSlots(int level) {
        if (level < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Level must be a positive integer: " + level);
        }
        List<Slot> slots = slotRepository.findAvailableByLevel(level);
        log.debug("Found {} available slots for level: {}", slots.size(), level);
        return slots;
    }

    @Override
    public List<Slot> getTeacherSlots(Long teacherId) {
        List<Slot> slots = slotRepository.findByTeacherId(teacherId);
        log.debug("Found {} slots for teacher: {}", slots.size(), teacherId);
        return slots;
    }

    @Override
    public List<Slot> getAllSlots() {
        return slotRepository.findAll();
    }

    @Override
    public Map<Long, Slot> getSlotsByIds(Collection<Long> slotIds) {
        if (slotIds.isEmpty()) {
            return Map.of();
        }
        return slotRepository.findAllByIds(slotIds).stream()
                .collect(Collectors.toMap(Slot::id, Function.identity()));
    }
}
