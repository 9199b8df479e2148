package com.murmur.eventmodel.payload;

import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventType;
import java.util.List;

/** Members were added to a group conversation. */
public record ConversationMemberAdded(String conversationId, String addedBy, List<String> memberIds)
        implements EventPayload {

    public ConversationMemberAdded {
        memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
    }

    @Override
    public EventType type() {
        return EventType.CONVERSATION_MEMBER_ADDED;
    }

    @Override
    public String aggregateId() {
        return conversationId;
    }

    @Override
    public List<String> validate() {
        List<String> errors =
                EventPayload.requireNonBlank("conversationId", conversationId, "addedBy", addedBy);
        EventPayload.requireNonEmpty(errors, "memberIds", memberIds);
        return errors;
    }
}
