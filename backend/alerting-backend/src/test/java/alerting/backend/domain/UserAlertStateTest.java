package alerting.backend.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class UserAlertStateTest {

    private static final LocalDateTime NOON = LocalDateTime.of(2026, 3, 2, 12, 0);
    private static final Duration TWO_HOURS = Duration.ofHours(2);

    @Test
    @DisplayName("a fresh row is due immediately")
    void freshRow_isDue() {
        assertThat(UserAlertState.unread("u1", 1L).isDueAt(NOON, TWO_HOURS)).isTrue();
    }

    @Test
    @DisplayName("the interval boundary itself is due")
    void intervalBoundary_isInclusive() {
        UserAlertState state = UserAlertState.unread("u1", 1L);
        state.setLastNotifiedAt(NOON);

        assertThat(state.isDueAt(NOON.plusHours(2).minusNanos(1), TWO_HOURS)).isFalse();
        assertThat(state.isDueAt(NOON.plusHours(2), TWO_HOURS)).isTrue();
    }

    @Test
    @DisplayName("snoozedUntil is exclusive")
    void snooze_endsAtStoredInstant() {
        UserAlertState state = UserAlertState.unread("u1", 1L);
        state.setSnoozedUntil(NOON.toLocalDate().plusDays(1).atStartOfDay());

        assertThat(state.isDueAt(NOON.toLocalDate().atTime(23, 59, 59, 999_999_999), TWO_HOURS)).isFalse();
        assertThat(state.isDueAt(NOON.toLocalDate().plusDays(1).atStartOfDay(), TWO_HOURS)).isTrue();
    }

    @Test
    @DisplayName("read state does not affect reminder eligibility")
    void readState_doesNotSuppress() {
        UserAlertState state = UserAlertState.unread("u1", 1L);
        state.markRead(NOON);

        assertThat(state.isDueAt(NOON, TWO_HOURS)).isTrue();
    }

    @Test
    @DisplayName("mark unread clears readAt and nothing else")
    void markUnread_restoresReadState() {
        UserAlertState state = UserAlertState.unread("u1", 1L);
        state.setLastNotifiedAt(NOON.minusHours(1));
        state.markRead(NOON);

        state.markUnread();

        assertThat(state.getReadStatus()).isEqualTo(ReadStatus.UNREAD);
        assertThat(state.getReadAt()).isNull();
        assertThat(state.getLastNotifiedAt()).isEqualTo(NOON.minusHours(1));
    }
}
