package com.murmur.eventmodel.payload;

import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventType;
import java.util.List;

/**
 * A member left or was removed from a conversation.
 *
 * @param removedBy the admin who removed the member, null when the member left on their own
 */
public record ConversationMemberLeft(String conversationId, String userId, String removedBy)
        implements EventPayload {

    @Override
    public EventType type() {
        return EventType.CONVERSATION_MEMBER_LEFT;
    }

    @Override
    public String aggregateId() {
        return conversationId;
    }

    @Override
    public List<String> validate() {
        return EventPayload.requireNonBlank("conversationId", conversationId, "userId", userId);
    }
}
