package com.talkwire.realtime.typing;

import com.talkwire.realtime.TestFixtures.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TypingSignalTrackerTest {

    private static final Duration TTL = Duration.ofSeconds(5);

    private MutableClock clock;
    private TypingSignalTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        tracker = new TypingSignalTracker(clock);
    }

    @Test
    void setTyping_newSignal_returnsTrue() {
        assertThat(tracker.setTyping(1L, 100L, TTL)).isTrue();

        assertThat(tracker.isTyping(1L, 100L)).isTrue();
        assertThat(tracker.typingIn(1L)).containsExactly(100L);
    }

    @Test
    void setTyping_refresh_returnsFalseAndExtendsExpiry() {
        tracker.setTyping(1L, 100L, TTL);
        clock.advance(Duration.ofSeconds(4));

        assertThat(tracker.setTyping(1L, 100L, TTL)).isFalse();
        clock.advance(Duration.ofSeconds(4));

        assertThat(tracker.isTyping(1L, 100L)).isTrue();
    }

    @Test
    void isTyping_atExpiry_readsAsNotTypingBeforeSweep() {
        tracker.setTyping(1L, 100L, TTL);
        clock.advance(TTL);

        assertThat(tracker.isTyping(1L, 100L)).isFalse();
        assertThat(tracker.typingIn(1L)).isEmpty();
        assertThat(tracker.getActiveSignalCount()).isZero();
    }

    @Test
    void clearTyping_liveSignal_returnsTrue() {
        tracker.setTyping(1L, 100L, TTL);

        assertThat(tracker.clearTyping(1L, 100L)).isTrue();
        assertThat(tracker.clearTyping(1L, 100L)).isFalse();
        assertThat(tracker.isTyping(1L, 100L)).isFalse();
    }

    @Test
    void clearTyping_expiredButNotSwept_returnsTrueAndSweepSkipsIt() {
        tracker.setTyping(1L, 100L, TTL);
        clock.advance(Duration.ofSeconds(6));

        assertThat(tracker.clearTyping(1L, 100L)).isTrue();
        assertThat(tracker.sweep(clock.instant())).isEmpty();
    }

    @Test
    void clearTyping_acrossRooms_returnsRoomsActuallyCleared() {
        tracker.setTyping(1L, 100L, TTL);
        tracker.setTyping(3L, 100L, TTL);
        tracker.setTyping(1L, 200L, TTL);

        List<Long> cleared = tracker.clearTyping(100L, List.of(1L, 2L, 3L));

        assertThat(cleared).containsExactlyInAnyOrder(1L, 3L);
        assertThat(tracker.isTyping(1L, 200L)).isTrue();
    }

    @Test
    void sweep_reportsEachExpiredSignalOnce() {
        tracker.setTyping(1L, 100L, TTL);
        tracker.setTyping(1L, 200L, Duration.ofSeconds(30));
        clock.advance(Duration.ofSeconds(6));

        List<TypingKey> first = tracker.sweep(clock.instant());
        List<TypingKey> second = tracker.sweep(clock.instant());

        assertThat(first).containsExactly(new TypingKey(1L, 100L));
        assertThat(second).isEmpty();
        assertThat(tracker.isTyping(1L, 200L)).isTrue();
    }

    @Test
    void sweep_afterExplicitClear_reportsNothing() {
        tracker.setTyping(1L, 100L, TTL);
        tracker.clearTyping(1L, 100L);
        clock.advance(Duration.ofSeconds(10));

        assertThat(tracker.sweep(clock.instant())).isEmpty();
    }

    @Test
    void sweep_refreshedSignal_isKept() {
        tracker.setTyping(1L, 100L, TTL);
        clock.advance(Duration.ofSeconds(4));
        tracker.setTyping(1L, 100L, TTL);
        clock.advance(Duration.ofSeconds(2));

        assertThat(tracker.sweep(clock.instant())).isEmpty();
        assertThat(tracker.isTyping(1L, 100L)).isTrue();
    }
}
