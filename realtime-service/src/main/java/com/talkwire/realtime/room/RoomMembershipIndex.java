package com.talkwire.realtime.room;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Room membership, independent of whether members are connected.
 * A room exists only while it has at least one member.
 */
@Slf4j
@Component
public class RoomMembershipIndex {

    // roomId -> member userIds
    private final Map<Long, Set<Long>> roomMembers = new ConcurrentHashMap<>();

    // userId -> roomIds, reverse lookup for presence fan-out
    private final Map<Long, Set<Long>> userRooms = new ConcurrentHashMap<>();

    /**
     * Adds the user to the room. Returns false if already a member.
     */
    public boolean join(Long roomId, Long userId) {
        AtomicBoolean added = new AtomicBoolean(false);
        roomMembers.compute(roomId, (rid, members) -> {
            Set<Long> next = members != null ? members : ConcurrentHashMap.newKeySet();
            added.set(next.add(userId));
            userRooms.compute(userId, (uid, joined) -> {
                Set<Long> rooms = joined != null ? joined : ConcurrentHashMap.newKeySet();
                rooms.add(rid);
                return rooms;
            });
            return next;
        });
        if (added.get()) {
            log.info("User {} joined room {}", userId, roomId);
        }
        return added.get();
    }

    /**
     * Removes the user from the room and drops the room once it is empty.
     * Returns false if the user was not a member.
     */
    public boolean leave(Long roomId, Long userId) {
        AtomicBoolean removed = new AtomicBoolean(false);
        roomMembers.computeIfPresent(roomId, (rid, members) -> {
            removed.set(members.remove(userId));
            userRooms.computeIfPresent(userId, (uid, rooms) -> {
                rooms.remove(rid);
                return rooms.isEmpty() ? null : rooms;
            });
            return members.isEmpty() ? null : members;
        });
        if (removed.get()) {
            log.info("User {} left room {}", userId, roomId);
            if (!roomMembers.containsKey(roomId)) {
                log.debug("Room {} removed (empty)", roomId);
            }
        }
        return removed.get();
    }

    public Set<Long> membersOf(Long roomId) {
        Set<Long> members = roomMembers.get(roomId);
        if (members == null || members.isEmpty()) {
            return Collections.emptySet();
        }
        return Set.copyOf(members);
    }

    public Set<Long> roomsOf(Long userId) {
        Set<Long> rooms = userRooms.get(userId);
        if (rooms == null || rooms.isEmpty()) {
            return Collections.emptySet();
        }
        return Set.copyOf(rooms);
    }

    public boolean isMember(Long roomId, Long userId) {
        Set<Long> members = roomMembers.get(roomId);
        return members != null && members.contains(userId);
    }

    public boolean hasRoom(Long roomId) {
        return roomMembers.containsKey(roomId);
    }

    public int getActiveRoomCount() {
        return roomMembers.size();
    }
}
