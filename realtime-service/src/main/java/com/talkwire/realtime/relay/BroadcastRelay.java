package com.talkwire.realtime.relay;

import com.talkwire.common.event.RoomBroadcastEvent;

import java.util.function.Consumer;

/**
 * Carries room broadcasts between realtime instances. When no relay bean is
 * present the dispatcher delivers to local connections only.
 */
public interface BroadcastRelay {

    void publish(RoomBroadcastEvent event);

    void subscribe(Consumer<RoomBroadcastEvent> handler);
}
