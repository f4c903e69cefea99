package com.talkwire.realtime.room;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomMembershipIndexTest {

    private RoomMembershipIndex index;

    @BeforeEach
    void setUp() {
        index = new RoomMembershipIndex();
    }

    @Test
    void join_createsRoomOnFirstMember() {
        assertThat(index.join(1L, 100L)).isTrue();

        assertThat(index.hasRoom(1L)).isTrue();
        assertThat(index.membersOf(1L)).containsExactly(100L);
        assertThat(index.roomsOf(100L)).containsExactly(1L);
    }

    @Test
    void join_twice_isIdempotent() {
        index.join(1L, 100L);

        assertThat(index.join(1L, 100L)).isFalse();
        assertThat(index.membersOf(1L)).containsExactly(100L);
    }

    @Test
    void leave_lastMember_deletesRoom() {
        index.join(1L, 100L);

        assertThat(index.leave(1L, 100L)).isTrue();

        assertThat(index.hasRoom(1L)).isFalse();
        assertThat(index.getActiveRoomCount()).isZero();
        assertThat(index.roomsOf(100L)).isEmpty();
    }

    @Test
    void leave_notMember_returnsFalse() {
        index.join(1L, 100L);

        assertThat(index.leave(1L, 200L)).isFalse();
        assertThat(index.leave(2L, 100L)).isFalse();
        assertThat(index.membersOf(1L)).containsExactly(100L);
    }

    @Test
    void membersOf_unknownRoom_returnsEmpty() {
        assertThat(index.membersOf(999L)).isEmpty();
    }

    @Test
    void membersOf_returnsImmutableCopy() {
        index.join(1L, 100L);

        Set<Long> members = index.membersOf(1L);
        index.join(1L, 200L);

        assertThat(members).containsExactly(100L);
        assertThatThrownBy(() -> members.add(300L)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void roomsOf_tracksMultipleRooms() {
        index.join(1L, 100L);
        index.join(2L, 100L);
        index.join(2L, 200L);

        index.leave(1L, 100L);

        assertThat(index.roomsOf(100L)).containsExactly(2L);
        assertThat(index.isMember(2L, 200L)).isTrue();
    }

    @Test
    void concurrentJoinAndLeave_noMemberLostOrLeaked() throws InterruptedException {
        int users = 50;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(users);

        for (long u = 1; u <= users; u++) {
            long userId = u;
            executor.submit(() -> {
                try {
                    for (int i = 0; i < 100; i++) {
                        index.join(1L, userId);
                        index.leave(1L, userId);
                    }
                    if (userId % 5 == 0) {
                        index.join(1L, userId);
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(index.membersOf(1L)).hasSize(users / 5);
        assertThat(index.membersOf(1L)).allMatch(userId -> userId % 5 == 0);
    }

    @Test
    void concurrentJoinAndLeaveAcrossRooms_roomsOfAgreesWithMembership() throws InterruptedException {
        int users = 20;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(users * 2);

        for (long u = 1; u <= users; u++) {
            long userId = u;
            executor.submit(() -> {
                try {
                    for (int i = 0; i < 500; i++) {
                        index.join(1L, userId);
                        index.leave(1L, userId);
                    }
                } finally {
                    done.countDown();
                }
            });
            executor.submit(() -> {
                try {
                    for (int i = 0; i < 500; i++) {
                        index.leave(2L, userId);
                        index.join(2L, userId);
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        for (long u = 1; u <= users; u++) {
            assertThat(index.isMember(1L, u)).isFalse();
            assertThat(index.isMember(2L, u)).isTrue();
            assertThat(index.roomsOf(u)).containsExactly(2L);
        }
        assertThat(index.hasRoom(1L)).isFalse();
    }
}
