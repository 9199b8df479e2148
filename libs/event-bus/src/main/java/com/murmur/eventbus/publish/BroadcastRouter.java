package com.murmur.eventbus.publish;

import com.murmur.eventmodel.EventEnvelope;
import com.murmur.eventmodel.EventPayload;
import java.util.List;

/** Decides which channels hear about a committed event, if any. */
@FunctionalInterface
public interface BroadcastRouter {

    BroadcastRouter NONE = event -> List.of();

    List<Broadcast> route(EventEnvelope<? extends EventPayload> event);
}
