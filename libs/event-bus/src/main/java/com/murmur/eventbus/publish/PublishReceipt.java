package com.murmur.eventbus.publish;

import com.murmur.eventbus.dispatch.DispatchReport;

/**
 * Returned once an event is durably logged.
 *
 * @param duplicate the eventId was already in the log; nothing was dispatched or broadcast again
 * @param dispatchDeferred another publish was dispatching the same aggregate and will run this
 *     event's listeners after its own; {@code dispatch} is empty
 * @param dispatch local listener outcomes; empty for duplicates and deferred dispatches
 */
public record PublishReceipt(
        String eventId,
        String aggregateId,
        long aggregateSequence,
        long position,
        boolean duplicate,
        boolean dispatchDeferred,
        DispatchReport dispatch) {

    public boolean fullyDispatched() {
        return !dispatchDeferred && dispatch.allSucceeded();
    }
}
