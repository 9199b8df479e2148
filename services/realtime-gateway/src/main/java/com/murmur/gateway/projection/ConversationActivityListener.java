package com.murmur.gateway.projection;

import com.murmur.eventmodel.EventEnvelope;
import com.murmur.eventmodel.payload.ConversationMemberLeft;
import com.murmur.eventmodel.payload.MessageSent;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps the last-message view of each conversation. Updates are upserts keyed by conversation, so
 * a replay after a crash between handling and recording converges to the same state, except for
 * the message counter.
 */
@Component
public class ConversationActivityListener {

    public static final String NAME = "conversation-activity";

    static final int PREVIEW_LENGTH = 80;

    private static final Logger log = LoggerFactory.getLogger(ConversationActivityListener.class);

    private final Map<String, ConversationActivity> activity = new ConcurrentHashMap<>();

    public void onMessageSent(EventEnvelope<MessageSent> event) {
        MessageSent message = event.payload();
        Instant at = event.timestamp();
        activity.compute(message.conversationId(), (id, current) -> {
            Set<String> participants = current == null ? new HashSet<>() : new HashSet<>(current.participants());
            participants.add(message.senderId());
            participants.addAll(message.recipientIds());
            long count = current == null ? 1 : current.messageCount() + 1;
            if (current != null && current.lastMessageAt() != null && current.lastMessageAt().isAfter(at)) {
                return new ConversationActivity(id, current.lastMessageId(), current.lastSenderId(),
                        current.preview(), current.lastMessageAt(), count, participants);
            }
            return new ConversationActivity(id, message.messageId(), message.senderId(),
                    preview(message.content()), at, count, participants);
        });
        log.debug("Conversation {} last message is now {}", message.conversationId(), message.messageId());
    }

    public void onMemberLeft(EventEnvelope<ConversationMemberLeft> event) {
        ConversationMemberLeft left = event.payload();
        activity.computeIfPresent(left.conversationId(), (id, current) -> {
            Set<String> participants = new HashSet<>(current.participants());
            participants.remove(left.userId());
            return new ConversationActivity(id, current.lastMessageId(), current.lastSenderId(),
                    current.preview(), current.lastMessageAt(), current.messageCount(), participants);
        });
    }

    public Optional<ConversationActivity> find(String conversationId) {
        return Optional.ofNullable(activity.get(conversationId));
    }

    public int size() {
        return activity.size();
    }

    static String preview(String content) {
        if (content == null) {
            return "";
        }
        return content.length() <= PREVIEW_LENGTH ? content : content.substring(0, PREVIEW_LENGTH);
    }
}
