package com.murmur.eventmodel;

import com.murmur.eventmodel.payload.CallEnded;
import com.murmur.eventmodel.payload.CallInitiated;
import com.murmur.eventmodel.payload.ConversationCreated;
import com.murmur.eventmodel.payload.ConversationMemberAdded;
import com.murmur.eventmodel.payload.ConversationMemberLeft;
import com.murmur.eventmodel.payload.FriendRequestAccepted;
import com.murmur.eventmodel.payload.FriendRequestSent;
import com.murmur.eventmodel.payload.MediaUploaded;
import com.murmur.eventmodel.payload.MessageDelivered;
import com.murmur.eventmodel.payload.MessageSeen;
import com.murmur.eventmodel.payload.MessageSent;
import com.murmur.eventmodel.payload.PrivacySettingsUpdated;
import com.murmur.eventmodel.payload.Unfriended;
import com.murmur.eventmodel.payload.UserBlocked;
import com.murmur.eventmodel.payload.UserUnblocked;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of event type tags.
 *
 * <p>Each tag names its payload record, the schema version that record represents, the aggregate
 * kind it is about and the module that owns it. Adding a variant means adding a constant here and
 * a payload record; nothing else dispatches on strings.
 */
public enum EventType {
    MESSAGE_SENT("MESSAGE_SENT", 2, AggregateType.CONVERSATION, "MessagingModule", MessageSent.class),
    MESSAGE_DELIVERED("MESSAGE_DELIVERED", 1, AggregateType.CONVERSATION, "MessagingModule", MessageDelivered.class),
    MESSAGE_SEEN("MESSAGE_SEEN", 1, AggregateType.CONVERSATION, "MessagingModule", MessageSeen.class),
    CONVERSATION_CREATED("CONVERSATION_CREATED", 1, AggregateType.CONVERSATION, "ConversationModule", ConversationCreated.class),
    CONVERSATION_MEMBER_ADDED("CONVERSATION_MEMBER_ADDED", 1, AggregateType.CONVERSATION, "ConversationModule", ConversationMemberAdded.class),
    CONVERSATION_MEMBER_LEFT("CONVERSATION_MEMBER_LEFT", 1, AggregateType.CONVERSATION, "ConversationModule", ConversationMemberLeft.class),
    USER_BLOCKED("USER_BLOCKED", 1, AggregateType.BLOCK, "BlockModule", UserBlocked.class),
    USER_UNBLOCKED("USER_UNBLOCKED", 1, AggregateType.BLOCK, "BlockModule", UserUnblocked.class),
    FRIEND_REQUEST_SENT("FRIEND_REQUEST_SENT", 1, AggregateType.FRIENDSHIP, "FriendshipModule", FriendRequestSent.class),
    FRIEND_REQUEST_ACCEPTED("FRIEND_REQUEST_ACCEPTED", 1, AggregateType.FRIENDSHIP, "FriendshipModule", FriendRequestAccepted.class),
    UNFRIENDED("UNFRIENDED", 1, AggregateType.FRIENDSHIP, "FriendshipModule", Unfriended.class),
    CALL_INITIATED("CALL_INITIATED", 1, AggregateType.CALL, "CallModule", CallInitiated.class),
    CALL_ENDED("CALL_ENDED", 2, AggregateType.CALL, "CallModule", CallEnded.class),
    PRIVACY_SETTINGS_UPDATED("PRIVACY_SETTINGS_UPDATED", 1, AggregateType.USER, "PrivacyModule", PrivacySettingsUpdated.class),
    MEDIA_UPLOADED("MEDIA_UPLOADED", 1, AggregateType.MEDIA, "MediaModule", MediaUploaded.class);

    private static final Map<String, EventType> BY_VALUE =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(EventType::value, Function.identity()));

    private final String value;
    private final int schemaVersion;
    private final AggregateType aggregateType;
    private final String owningModule;
    private final Class<? extends EventPayload> payloadClass;

    EventType(
            String value,
            int schemaVersion,
            AggregateType aggregateType,
            String owningModule,
            Class<? extends EventPayload> payloadClass) {
        this.value = value;
        this.schemaVersion = schemaVersion;
        this.aggregateType = aggregateType;
        this.owningModule = owningModule;
        this.payloadClass = payloadClass;
    }

    /** Wire tag carried in {@link EventEnvelope#eventType()}. */
    public String value() {
        return value;
    }

    /** Version of the payload shape that {@link #payloadClass()} represents. */
    public int schemaVersion() {
        return schemaVersion;
    }

    public AggregateType aggregateType() {
        return aggregateType;
    }

    /** Default {@link EventEnvelope#source()} for events of this type. */
    public String owningModule() {
        return owningModule;
    }

    public Class<? extends EventPayload> payloadClass() {
        return payloadClass;
    }

    /**
     * Resolves a wire tag.
     *
     * @throws IllegalArgumentException if the tag is unknown
     */
    public static EventType fromString(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + value));
    }

    /** Resolves a wire tag, empty when the tag is null or unknown. */
    public static Optional<EventType> find(String value) {
        return value == null ? Optional.empty() : Optional.ofNullable(BY_VALUE.get(value));
    }

    public static boolean isKnown(String value) {
        return find(value).isPresent();
    }
}
