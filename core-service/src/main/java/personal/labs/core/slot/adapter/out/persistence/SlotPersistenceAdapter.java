package personal.labs.core.slot.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.labs.core.slot.application.port.out.SlotRepository;
import personal.labs.core.slot.domain.model.Slot;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Slot Persistence Adapter
 * JPA를 사용한 실습 세션 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotPersistenceAdapter implements SlotRepository {

    private final JpaSlotRepository jpaSlotRepository;

    @Override
    public Optional<Slot> findById(Long slotId) {
        log.debug("Finding slot by id: {}", slotId);
        return jpaSlotRepository.findById(slotId)
                .map(SlotEntity::toDomain);
    }

    @Override
    public Optional<Slot> findByIdForUpdate(Long slotId) {
        log.debug("Locking slot: {}", slotId);
        return jpaSlotRepository.findByIdForUpdate(slotId)
                .map(SlotEntity::toDomain);
    }

    @Override
    public List<Slot> findAvailableByLevel(int level) {
        return toDomain(jpaSlotRepository.findAvailableByLevel(level));
    }

    @Override
    public List<Slot> findByTeacherId(Long teacherId) {
        return toDomain(jpaSlotRepository.findByTeacherIdOrderByDateAscStartTimeAscIdAsc(teacherId));
    }

    @Override
    public List<Slot> findAll() {
        return toDomain(jpaSlotRepository.findAllByOrderByDateAscStartTimeAscIdAsc());
    }

    @Override
    public List<Slot> findAllByIds(Collection<Long> slotIds) {
        return toDomain(jpaSlotRepository.findByIdIn(List.copyOf(slotIds)));
    }

    @Override
    public Slot save(Slot slot) {
        log.debug("Saving slot: slotId={}, currentBookings={}, active={}",
                slot.id(), slot.currentBookings(), slot.active());
        SlotEntity saved = jpaSlotRepository.save(SlotEntity.fromDomain(slot));
        return saved.toDomain();
    }

    @Override
    public void deleteById(Long slotId) {
        log.debug("Deleting slot: {}", slotId);
        jpaSlotRepository.deleteById(slotId);
    }

    private List<Slot> toDomain(List<SlotEntity> entities) {
        return entities.stream()
                .map(SlotEntity::toDomain)
                .toList();
    }
}
