package com.murmur.eventmodel.payload;

import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventType;
import java.util.List;

/**
 * A voice or video call started ringing.
 *
 * @param callType VOICE or VIDEO
 * @param conversationId conversation the call was started from, may be null for ad-hoc calls
 */
public record CallInitiated(
        String callId, String callerId, List<String> calleeIds, String callType, String conversationId)
        implements EventPayload {

    public CallInitiated {
        calleeIds = calleeIds == null ? List.of() : List.copyOf(calleeIds);
    }

    @Override
    public EventType type() {
        return EventType.CALL_INITIATED;
    }

    @Override
    public String aggregateId() {
        return callId;
    }

    @Override
    public List<String> validate() {
        List<String> errors = EventPayload.requireNonBlank(
                "callId", callId,
                "callerId", callerId,
                "callType", callType);
        EventPayload.requireNonEmpty(errors, "calleeIds", calleeIds);
        return errors;
    }
}
