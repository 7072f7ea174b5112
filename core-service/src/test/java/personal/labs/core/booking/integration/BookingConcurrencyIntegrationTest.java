package personal.labs.core.booking.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import personal.labs.common.exception.BusinessException;
import personal.labs.core.acceptance.support.TestIdentityConfig;
import personal.labs.core.booking.adapter.out.persistence.JpaBookingRepository;
import personal.labs.core.booking.application.port.in.CancelBookingCommand;
import personal.labs.core.booking.application.port.in.CancelBookingUseCase;
import personal.labs.core.booking.application.port.in.CreateBookingCommand;
import personal.labs.core.booking.application.port.in.CreateBookingUseCase;
import personal.labs.core.booking.application.port.in.GetBookingUseCase;
import personal.labs.core.booking.application.port.out.BookingRepository;
import personal.labs.core.booking.domain.exception.BookingAlreadyCancelledException;
import personal.labs.core.booking.domain.exception.DuplicateBookingException;
import personal.labs.core.booking.domain.exception.SlotFullException;
import personal.labs.core.booking.domain.model.Booking;
import personal.labs.core.booking.domain.model.BookingStatus;
import personal.labs.core.slot.adapter.out.persistence.JpaSlotRepository;
import personal.labs.core.slot.application.port.in.CreateSlotCommand;
import personal.labs.core.slot.application.port.in.CreateSlotUseCase;
import personal.labs.core.slot.application.port.in.DeleteSlotUseCase;
import personal.labs.core.slot.application.port.in.GetSlotUseCase;
import personal.labs.core.slot.domain.model.Slot;
import personal.labs.core.slot.domain.model.SlotDetails;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 예약/취소 동시성 통합 테스트 (H2, 실제 트랜잭션과 행 락 사용)
 * 어떤 경합 상황에서도 세션 카운터와 확정 예약 수가 일치해야 한다
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestIdentityConfig.class)
class BookingConcurrencyIntegrationTest {

    private static final Long TEACHER_ID = 10L;

    @Autowired
    private CreateSlotUseCase createSlotUseCase;
    @Autowired
    private DeleteSlotUseCase deleteSlotUseCase;
    @Autowired
    private GetSlotUseCase getSlotUseCase;
    @Autowired
    private CreateBookingUseCase createBookingUseCase;
    @Autowired
    private CancelBookingUseCase cancelBookingUseCase;
    @Autowired
    private GetBookingUseCase getBookingUseCase;
    @Autowired
    private BookingRepository bookingRepository;
    @Autowired
    private JpaBookingRepository jpaBookingRepository;
    @Autowired
    private JpaSlotRepository jpaSlotRepository;

    @BeforeEach
    void setUp() {
        jpaBookingRepository.deleteAllInBatch();
        jpaSlotRepository.deleteAllInBatch();
    }

    private Slot openSlot(int maxStudents) {
        SlotDetails details = new SlotDetails(2, LocalDate.of(2026, 3, 2),
                LocalTime.of(14, 0), LocalTime.of(15, 30),
                "기초 회로", null, "3층 실습실", maxStudents);
        return createSlotUseCase.createSlot(new CreateSlotCommand(TEACHER_ID, "김교사", details));
    }

    private Booking book(Long studentId, Long slotId) {
        return createBookingUseCase.createBooking(
                new CreateBookingCommand(studentId, "student-" + studentId, slotId, null));
    }

    private void assertCounterMatchesLedger(Long slotId, int expected) {
        assertThat(getSlotUseCase.getSlot(slotId).currentBookings()).isEqualTo(expected);
        assertThat(bookingRepository.findConfirmedBySlotId(slotId)).hasSize(expected);
    }

    /**
     * 모든 작업을 동시에 출발시키고 결과(또는 예외)를 모은다
     */
    private <T> List<Object> runConcurrently(List<Callable<T>> tasks) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch startLatch = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (Callable<T> task : tasks) {
                futures.add(executor.submit(() -> {
                    startLatch.await();
                    return task.call();
                }));
            }
            startLatch.countDown();

            List<Object> outcomes = new ArrayList<>();
            for (Future<T> future : futures) {
                try {
                    outcomes.add(future.get(30, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    outcomes.add(e.getCause());
                } catch (TimeoutException e) {
                    throw new AssertionError("Concurrent task did not finish in time", e);
                }
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("정원 3명 세션에 학생 20명이 동시에 예약하면 3명만 성공하고 나머지는 정원 초과")
    void concurrentBookings_neverExceedCapacity() throws InterruptedException {
        // given
        Slot slot = openSlot(3);
        List<Callable<Booking>> tasks = new ArrayList<>();
        for (long studentId = 1; studentId <= 20; studentId++) {
            long id = studentId;
            tasks.add(() -> book(id, slot.id()));
        }

        // when
        List<Object> outcomes = runConcurrently(tasks);

        // then
        assertThat(outcomes).filteredOn(Booking.class::isInstance).hasSize(3);
        assertThat(outcomes).filteredOn(SlotFullException.class::isInstance).hasSize(17);
        assertCounterMatchesLedger(slot.id(), 3);
    }

    @Test
    @DisplayName("같은 학생이 같은 세션에 동시에 예약해도 확정 예약은 하나뿐")
    void concurrentDuplicateBookings_confirmOnlyOne() throws InterruptedException {
        // given
        Slot slot = openSlot(5);
        List<Callable<Booking>> tasks = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            tasks.add(() -> book(101L, slot.id()));
        }

        // when
        List<Object> outcomes = runConcurrently(tasks);

        // then
        assertThat(outcomes).filteredOn(Booking.class::isInstance).hasSize(1);
        assertThat(outcomes).filteredOn(DuplicateBookingException.class::isInstance).hasSize(7);
        assertCounterMatchesLedger(slot.id(), 1);
    }

    @Test
    @DisplayName("같은 예약을 동시에 여러 번 취소해도 인원은 한 번만 감소")
    void concurrentCancels_decrementOnce() throws InterruptedException {
        // given
        Slot slot = openSlot(3);
        Booking booking = book(101L, slot.id());
        book(102L, slot.id());

        List<Callable<Booking>> tasks = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            tasks.add(() -> cancelBookingUseCase.cancelBooking(new CancelBookingCommand(booking.id(), 101L)));
        }

        // when
        List<Object> outcomes = runConcurrently(tasks);

        // then
        assertThat(outcomes).filteredOn(Booking.class::isInstance).hasSize(1);
        assertThat(outcomes).filteredOn(BookingAlreadyCancelledException.class::isInstance).hasSize(5);
        assertCounterMatchesLedger(slot.id(), 1);
    }

    @Test
    @DisplayName("예약과 취소가 섞여 들어와도 카운터와 원장이 일치")
    void mixedBookAndCancel_keepCounterConsistent() throws InterruptedException {
        // given
        Slot slot = openSlot(4);
        List<Booking> existing = new ArrayList<>();
        for (long studentId = 1; studentId <= 4; studentId++) {
            existing.add(book(studentId, slot.id()));
        }

        List<Callable<Booking>> tasks = new ArrayList<>();
        for (Booking booking : existing) {
            tasks.add(() -> cancelBookingUseCase.cancelBooking(
                    new CancelBookingCommand(booking.id(), booking.studentId())));
        }
        for (long studentId = 11; studentId <= 18; studentId++) {
            long id = studentId;
            tasks.add(() -> book(id, slot.id()));
        }

        // when
        List<Object> outcomes = runConcurrently(tasks);

        // then
        assertThat(outcomes)
                .allSatisfy(outcome -> assertThat(outcome).isInstanceOfAny(Booking.class, SlotFullException.class));
        int confirmed = bookingRepository.findConfirmedBySlotId(slot.id()).size();
        assertThat(confirmed).isBetween(0, 4);
        assertCounterMatchesLedger(slot.id(), confirmed);
    }

    @Test
    @DisplayName("정원 2명: A 예약, A 중복 실패, B 예약, C 정원 초과, A 취소 후 C 예약 성공")
    void bookingLifecycle_capacityTwo() {
        // given
        Slot slot = openSlot(2);

        // when & then
        Booking bookingA = book(1L, slot.id());
        assertThat(bookingA.status()).isEqualTo(BookingStatus.CONFIRMED);

        assertThatThrownBy(() -> book(1L, slot.id())).isInstanceOf(DuplicateBookingException.class);

        book(2L, slot.id());
        assertThatThrownBy(() -> book(3L, slot.id())).isInstanceOf(SlotFullException.class);
        assertCounterMatchesLedger(slot.id(), 2);

        Booking cancelled = cancelBookingUseCase.cancelBooking(new CancelBookingCommand(bookingA.id(), 1L));
        assertThat(cancelled.status()).isEqualTo(BookingStatus.CANCELLED);
        assertCounterMatchesLedger(slot.id(), 1);

        book(3L, slot.id());
        assertCounterMatchesLedger(slot.id(), 2);
    }

    @Test
    @DisplayName("취소 후 같은 학생이 다시 예약할 수 있다")
    void rebookAfterCancel() {
        // given
        Slot slot = openSlot(2);
        Booking first = book(1L, slot.id());
        cancelBookingUseCase.cancelBooking(new CancelBookingCommand(first.id(), 1L));

        // when
        Booking second = book(1L, slot.id());

        // then
        assertThat(second.id()).isNotEqualTo(first.id());
        assertCounterMatchesLedger(slot.id(), 1);
    }

    @Test
    @DisplayName("세션을 삭제하면 확정 예약이 취소 이력으로 남는다")
    void deleteSlot_cancelsActiveBookings() {
        // given
        Slot slot = openSlot(3);
        book(1L, slot.id());
        book(2L, slot.id());

        // when
        int cancelled = deleteSlotUseCase.deleteSlot(slot.id(), TEACHER_ID);

        // then
        assertThat(cancelled).isEqualTo(2);
        assertThat(getBookingUseCase.getStudentBookings(1L))
                .singleElement()
                .satisfies(view -> {
                    assertThat(view.booking().status()).isEqualTo(BookingStatus.CANCELLED);
                    assertThat(view.hasSlot()).isFalse();
                });
    }

    @Test
    @DisplayName("이미 취소된 예약을 다시 취소하면 no-op 예외")
    void cancelTwice_isNoOp() {
        // given
        Slot slot = openSlot(2);
        Booking booking = book(1L, slot.id());
        cancelBookingUseCase.cancelBooking(new CancelBookingCommand(booking.id(), 1L));

        // when & then
        assertThatThrownBy(() -> cancelBookingUseCase.cancelBooking(new CancelBookingCommand(booking.id(), 1L)))
                .isInstanceOf(BookingAlreadyCancelledException.class)
                .isInstanceOf(BusinessException.class);
        assertCounterMatchesLedger(slot.id(), 0);
    }
}
