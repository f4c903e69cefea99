package com.talkwire.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Relayed between realtime instances so that each one can deliver a room
 * broadcast to its locally connected members.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RoomBroadcastEvent extends DomainEvent {

    public static final String TYPE = "ROOM_BROADCAST";

    private String originInstanceId;
    private Long roomId;
    private Long excludeUserId;
    private String payload;

    public RoomBroadcastEvent(String originInstanceId, Long roomId, Long excludeUserId, String payload) {
        super(TYPE);
        this.originInstanceId = originInstanceId;
        this.roomId = roomId;
        this.excludeUserId = excludeUserId;
        this.payload = payload;
    }

    public boolean isFrom(String instanceId) {
        return originInstanceId != null && originInstanceId.equals(instanceId);
    }
}
