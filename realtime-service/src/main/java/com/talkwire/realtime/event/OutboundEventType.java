package com.talkwire.realtime.event;

public enum OutboundEventType {
    CONNECTION_SUCCESS,
    PONG,
    ROOM_JOINED,
    ROOM_LEFT,
    TYPING,
    NEW_MESSAGE,
    MESSAGE_SENT,
    READ_RECEIPT,
    PRESENCE_UPDATE,
    SYNC_RESPONSE,
    ERROR,
    UNKNOWN_EVENT
}
