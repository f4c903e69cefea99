package com.talkwire.realtime.dispatch;

import com.talkwire.realtime.registry.Disconnection;
import com.talkwire.realtime.transport.CloseReason;

/**
 * Published after the dispatcher has unregistered a connection whose send failed.
 */
public record ConnectionDroppedEvent(Disconnection disconnection, CloseReason reason) {
}
