package personal.labs.core.booking.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import personal.labs.core.acceptance.support.TestIdentityConfig;
import personal.labs.core.booking.adapter.out.persistence.JpaBookingRepository;
import personal.labs.core.booking.application.port.in.CancelBookingCommand;
import personal.labs.core.booking.application.port.in.CancelBookingUseCase;
import personal.labs.core.booking.application.port.in.CreateBookingCommand;
import personal.labs.core.booking.application.port.in.CreateBookingUseCase;
import personal.labs.core.booking.application.port.in.GetBookingUseCase;
import personal.labs.core.booking.application.port.out.BookingRepository;
import personal.labs.core.booking.domain.exception.BookingAlreadyCancelledException;
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

/**
 * 커넥션 기본 격리 수준이 REPEATABLE READ(MySQL InnoDB 기본값)여도
 * 세션 락을 기다린 취소가 마지막 커밋 상태를 보고 판단하는지 검증
 */
@SpringBootTest(properties = "spring.datasource.hikari.transaction-isolation=TRANSACTION_REPEATABLE_READ")
@ActiveProfiles("test")
@Import(TestIdentityConfig.class)
class BookingCancelIsolationIntegrationTest {

    private static final Long TEACHER_ID = 10L;
    private static final Long STUDENT_ID = 1L;
    private static final long QUEUE_UP_MILLIS = 300L;

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
    @Autowired
    private PlatformTransactionManager transactionManager;

    @BeforeEach
    void setUp() {
        jpaBookingRepository.deleteAllInBatch();
        jpaSlotRepository.deleteAllInBatch();
    }

    private Slot openSlot() {
        SlotDetails details = new SlotDetails(2, LocalDate.of(2026, 3, 2),
                LocalTime.of(14, 0), LocalTime.of(15, 30),
                "기초 회로", null, "3층 실습실", 3);
        return createSlotUseCase.createSlot(new CreateSlotCommand(TEACHER_ID, "김교사", details));
    }

    private Booking book(Long studentId, Long slotId) {
        return createBookingUseCase.createBooking(
                new CreateBookingCommand(studentId, "student-" + studentId, slotId, null));
    }

    /**
     * 세션 행 락을 잡은 상태에서 작업들을 출발시켜 모두 락 대기열에 세운 뒤 락을 놓는다
     */
    private List<Object> runBehindSlotLock(Long slotId, List<Callable<?>> tasks) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size() + 1);
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            Future<?> holder = executor.submit(() -> new TransactionTemplate(transactionManager)
                    .executeWithoutResult(status -> {
                        jpaSlotRepository.findByIdForUpdate(slotId);
                        locked.countDown();
                        try {
                            release.await();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new IllegalStateException(e);
                        }
                    }));
            assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

            List<Future<?>> futures = new ArrayList<>();
            for (Callable<?> task : tasks) {
                futures.add(executor.submit(task));
            }
            Thread.sleep(QUEUE_UP_MILLIS);
            release.countDown();
            holder.get(10, TimeUnit.SECONDS);

            List<Object> outcomes = new ArrayList<>();
            for (Future<?> future : futures) {
                try {
                    outcomes.add(future.get(30, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    outcomes.add(e.getCause());
                } catch (TimeoutException e) {
                    throw new AssertionError("Task waiting on slot lock did not finish in time", e);
                }
            }
            return outcomes;
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("락 대기 중이던 중복 취소 두 건 - 한 건만 반영되고 나머지는 no-op")
    void duplicateCancelsQueuedOnSlotLock_decrementOnce() throws Exception {
        // given
        Slot slot = openSlot();
        Booking booking = book(STUDENT_ID, slot.id());
        book(2L, slot.id());
        CancelBookingCommand command = new CancelBookingCommand(booking.id(), STUDENT_ID);

        // when
        List<Object> outcomes = runBehindSlotLock(slot.id(), List.of(
                () -> cancelBookingUseCase.cancelBooking(command),
                () -> cancelBookingUseCase.cancelBooking(command)));

        // then
        assertThat(outcomes).filteredOn(Booking.class::isInstance).hasSize(1);
        assertThat(outcomes).filteredOn(BookingAlreadyCancelledException.class::isInstance).hasSize(1);
        assertThat(getSlotUseCase.getSlot(slot.id()).currentBookings()).isEqualTo(1);
        assertThat(bookingRepository.findConfirmedBySlotId(slot.id())).hasSize(1);
    }

    @Test
    @DisplayName("세션 삭제와 겹친 취소 - 어느 쪽이 먼저든 예약은 한 번만 취소됨")
    void cancelQueuedWithDelete_cancelsOnce() throws Exception {
        // given
        Slot slot = openSlot();
        Booking booking = book(STUDENT_ID, slot.id());

        // when
        List<Object> outcomes = runBehindSlotLock(slot.id(), List.of(
                () -> deleteSlotUseCase.deleteSlot(slot.id(), TEACHER_ID),
                () -> cancelBookingUseCase.cancelBooking(new CancelBookingCommand(booking.id(), STUDENT_ID))));

        // then
        Object deleteOutcome = outcomes.get(0);
        Object cancelOutcome = outcomes.get(1);
        assertThat(deleteOutcome).isInstanceOf(Integer.class);
        if (cancelOutcome instanceof Booking) {
            assertThat(deleteOutcome).isEqualTo(0);
        } else {
            assertThat(cancelOutcome).isInstanceOf(BookingAlreadyCancelledException.class);
            assertThat(deleteOutcome).isEqualTo(1);
        }
        assertThat(getBookingUseCase.getStudentBookings(STUDENT_ID))
                .singleElement()
                .satisfies(view -> assertThat(view.booking().status()).isEqualTo(BookingStatus.CANCELLED));
    }
}
