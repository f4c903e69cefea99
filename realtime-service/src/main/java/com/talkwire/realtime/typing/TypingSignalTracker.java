package com.talkwire.realtime.typing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived "is typing" signals per (room, user).
 * <p>
 * Expiry is authoritative: a signal at or past its expiry reads as not typing
 * even before {@link #sweep(Instant)} removes it. The sweep only frees memory
 * and reports each expired signal once so the caller can broadcast the stop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TypingSignalTracker {

    private final Clock clock;

    // (roomId, userId) -> expiry
    private final Map<TypingKey, Instant> signals = new ConcurrentHashMap<>();

    /**
     * Records or refreshes a signal. Returns true when the user was not
     * already typing in the room.
     */
    public boolean setTyping(Long roomId, Long userId, Duration ttl) {
        Instant now = clock.instant();
        Instant previous = signals.put(new TypingKey(roomId, userId), now.plus(ttl));
        return previous == null || !previous.isAfter(now);
    }

    /**
     * Removes a signal. Returns true when an entry was removed, including one
     * that has expired but not been swept yet: the sweep will no longer report
     * it, so the caller owns the stop broadcast.
     */
    public boolean clearTyping(Long roomId, Long userId) {
        return signals.remove(new TypingKey(roomId, userId)) != null;
    }

    /**
     * Clears the user's signals in the given rooms and returns the rooms in
     * which a signal was actually removed.
     */
    public List<Long> clearTyping(Long userId, Collection<Long> roomIds) {
        List<Long> cleared = new ArrayList<>();
        for (Long roomId : roomIds) {
            if (signals.remove(new TypingKey(roomId, userId)) != null) {
                cleared.add(roomId);
            }
        }
        return cleared;
    }

    public boolean isTyping(Long roomId, Long userId) {
        Instant expiry = signals.get(new TypingKey(roomId, userId));
        return expiry != null && expiry.isAfter(clock.instant());
    }

    public Set<Long> typingIn(Long roomId) {
        Instant now = clock.instant();
        Set<Long> users = ConcurrentHashMap.newKeySet();
        signals.forEach((key, expiry) -> {
            if (key.roomId().equals(roomId) && expiry.isAfter(now)) {
                users.add(key.userId());
            }
        });
        return Set.copyOf(users);
    }

    /**
     * Removes and returns every signal whose expiry is at or before {@code now}.
     * Uses a conditional remove so a refresh racing with the sweep is kept and
     * no expiry is reported twice.
     */
    public List<TypingKey> sweep(Instant now) {
        List<TypingKey> expired = new ArrayList<>();
        for (Map.Entry<TypingKey, Instant> entry : signals.entrySet()) {
            Instant expiry = entry.getValue();
            if (!expiry.isAfter(now) && signals.remove(entry.getKey(), expiry)) {
                expired.add(entry.getKey());
            }
        }
        if (!expired.isEmpty()) {
            log.debug("Expired {} typing signals", expired.size());
        }
        return expired;
    }

    /**
     * Number of signals that have not expired yet.
     */
    public int getActiveSignalCount() {
        Instant now = clock.instant();
        int count = 0;
        for (Instant expiry : signals.values()) {
            if (expiry.isAfter(now)) {
                count++;
            }
        }
        return count;
    }
}
