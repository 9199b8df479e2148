package com.murmur.eventmodel.payload;

import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventType;
import java.util.List;

/**
 * A call finished.
 *
 * <p>Version 2 shape. Version 1 reported {@code durationMs} and had no {@code endReason}.
 *
 * @param endReason COMPLETED, MISSED, REJECTED or FAILED
 */
public record CallEnded(String callId, String endedBy, long durationSeconds, String endReason)
        implements EventPayload {

    @Override
    public EventType type() {
        return EventType.CALL_ENDED;
    }

    @Override
    public String aggregateId() {
        return callId;
    }

    @Override
    public List<String> validate() {
        List<String> errors = EventPayload.requireNonBlank(
                "callId", callId,
                "endedBy", endedBy,
                "endReason", endReason);
        if (durationSeconds < 0) {
            errors.add("durationSeconds must not be negative");
        }
        return errors;
    }
}
