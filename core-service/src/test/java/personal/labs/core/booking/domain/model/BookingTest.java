package personal.labs.core.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.labs.common.exception.BusinessException;
import personal.labs.core.booking.domain.exception.BookingAccessDeniedException;
import personal.labs.core.booking.domain.exception.BookingAlreadyCancelledException;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Booking 도메인 모델 단위 테스트")
class BookingTest {

    private static final Long SLOT_ID = 1L;
    private static final Long STUDENT_ID = 100L;

    @Test
    @DisplayName("예약은 CONFIRMED 상태로 생성되고 메모는 정리된다")
    void create_Confirmed() {
        Booking booking = Booking.create(SLOT_ID, STUDENT_ID, "이학생", "  노트북 지참  ");

        assertThat(booking.status()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(booking.notes()).isEqualTo("노트북 지참");
        assertThat(booking.cancelledAt()).isNull();
    }

    @Test
    @DisplayName("빈 메모는 null 로 저장된다")
    void create_BlankNotes() {
        assertThat(Booking.create(SLOT_ID, STUDENT_ID, "이학생", "   ").notes()).isNull();
    }

    @Test
    @DisplayName("메모가 500자를 넘으면 실패")
    void create_NotesTooLong() {
        String notes = "가".repeat(Booking.MAX_NOTES_LENGTH + 1);

        assertThatThrownBy(() -> Booking.create(SLOT_ID, STUDENT_ID, "이학생", notes))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("Notes");
    }

    @Test
    @DisplayName("취소하면 CANCELLED 상태와 취소 시각이 기록된다")
    void cancel_Success() {
        Booking booking = confirmed();

        Booking cancelled = booking.cancel();

        assertThat(cancelled.isCancelled()).isTrue();
        assertThat(cancelled.cancelledAt()).isNotNull();
        assertThat(cancelled.createdAt()).isEqualTo(booking.createdAt());
    }

    @Test
    @DisplayName("취소된 예약은 다시 취소할 수 없다")
    void cancel_AlreadyCancelled() {
        Booking cancelled = confirmed().cancel();

        assertThatThrownBy(cancelled::cancel).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(cancelled::ensureConfirmed).isInstanceOf(BookingAlreadyCancelledException.class);
    }

    @Test
    @DisplayName("본인 예약이 아니면 소유권 검증 실패")
    void ensureOwnership_OtherStudent() {
        assertThatThrownBy(() -> confirmed().ensureOwnership(200L))
                .isInstanceOf(BookingAccessDeniedException.class);
    }

    private Booking confirmed() {
        return new Booking(7L, SLOT_ID, STUDENT_ID, "이학생", null,
                BookingStatus.CONFIRMED, LocalDateTime.now().minusMinutes(5), null);
    }
}
