package com.murmur.eventmodel.payload;

import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventType;
import java.util.List;

/**
 * A direct or group conversation was created.
 *
 * @param conversationId new conversation
 * @param creatorId user who created it
 * @param conversationType DIRECT or GROUP
 * @param memberIds initial members, creator included
 */
public record ConversationCreated(
        String conversationId, String creatorId, String conversationType, List<String> memberIds)
        implements EventPayload {

    public ConversationCreated {
        memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
    }

    @Override
    public EventType type() {
        return EventType.CONVERSATION_CREATED;
    }

    @Override
    public String aggregateId() {
        return conversationId;
    }

    @Override
    public List<String> validate() {
        List<String> errors = EventPayload.requireNonBlank(
                "conversationId", conversationId,
                "creatorId", creatorId,
                "conversationType", conversationType);
        EventPayload.requireNonEmpty(errors, "memberIds", memberIds);
        return errors;
    }
}
