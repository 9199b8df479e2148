package com.murmur.gateway.projection;

import java.time.Instant;
import java.util.Set;

/** Latest activity of one conversation as seen through MESSAGE_SENT events. */
public record ConversationActivity(
        String conversationId,
        String lastMessageId,
        String lastSenderId,
        String preview,
        Instant lastMessageAt,
        long messageCount,
        Set<String> participants) {

    public ConversationActivity {
        participants = participants == null ? Set.of() : Set.copyOf(participants);
    }
}
