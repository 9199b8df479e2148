package com.murmur.eventmodel.versioning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.murmur.eventmodel.EventType;

/**
 * The platform's version table.
 *
 * <ul>
 *   <li>MESSAGE_SENT v1 {@code text} became v2 {@code content} plus {@code messageType} (TEXT for
 *       every v1 message).
 *   <li>CALL_ENDED v1 {@code durationMs} became v2 {@code durationSeconds} plus {@code endReason}
 *       (COMPLETED for every v1 call).
 * </ul>
 *
 * Downgrades keep {@code messageType} and {@code endReason} as extra fields, which v1 readers
 * ignore, so that upgrading a downgraded event restores it exactly. Upgrades only apply the
 * defaults when those fields are absent.
 */
public final class DefaultEventVersions {

    static final String DEFAULT_MESSAGE_TYPE = "TEXT";
    static final String DEFAULT_END_REASON = "COMPLETED";

    private DefaultEventVersions() {
        // utility class
    }

    public static EventVersioningRegistry registry() {
        return EventVersioningRegistry.builder()
                .register(messageSent())
                .register(callEnded())
                .build();
    }

    static VersionStrategy messageSent() {
        return VersionStrategy.forType(EventType.MESSAGE_SENT.value())
                .currentVersion(EventType.MESSAGE_SENT.schemaVersion())
                .upgrade(1, DefaultEventVersions::messageSentV1ToV2)
                .downgrade(2, DefaultEventVersions::messageSentV2ToV1)
                .build();
    }

    static VersionStrategy callEnded() {
        return VersionStrategy.forType(EventType.CALL_ENDED.value())
                .currentVersion(EventType.CALL_ENDED.schemaVersion())
                .upgrade(1, DefaultEventVersions::callEndedV1ToV2)
                .downgrade(2, DefaultEventVersions::callEndedV2ToV1)
                .build();
    }

    private static ObjectNode messageSentV1ToV2(ObjectNode payload) {
        rename(payload, "text", "content");
        if (!payload.hasNonNull("messageType")) {
            payload.put("messageType", DEFAULT_MESSAGE_TYPE);
        }
        return payload;
    }

    private static ObjectNode messageSentV2ToV1(ObjectNode payload) {
        rename(payload, "content", "text");
        return payload;
    }

    private static ObjectNode callEndedV1ToV2(ObjectNode payload) {
        long durationMs = payload.path("durationMs").asLong(0);
        payload.remove("durationMs");
        putNumber(payload, "durationSeconds", durationMs / 1000);
        if (!payload.hasNonNull("endReason")) {
            payload.put("endReason", DEFAULT_END_REASON);
        }
        return payload;
    }

    private static ObjectNode callEndedV2ToV1(ObjectNode payload) {
        long durationSeconds = payload.path("durationSeconds").asLong(0);
        payload.remove("durationSeconds");
        putNumber(payload, "durationMs", durationSeconds * 1000);
        return payload;
    }

    private static void rename(ObjectNode payload, String from, String to) {
        JsonNode value = payload.remove(from);
        payload.set(to, value == null ? TextNode.valueOf("") : value);
    }

    /** Keeps small values as int nodes, the way the JSON parser reads them back. */
    private static void putNumber(ObjectNode payload, String field, long value) {
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            payload.put(field, (int) value);
        } else {
            payload.put(field, value);
        }
    }
}
