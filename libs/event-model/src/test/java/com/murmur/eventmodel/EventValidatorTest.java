package com.murmur.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.murmur.eventmodel.payload.CallEnded;
import com.murmur.eventmodel.payload.MessageSent;
import com.murmur.eventmodel.payload.UserBlocked;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EventValidator")
class EventValidatorTest {

    private static final MessageSent MESSAGE =
            new MessageSent("m-1", "conv-1", "alice", null, "TEXT", "hi", List.of("bob"));

    private static EventEnvelope<MessageSent> envelope(
            String eventId, String eventType, int version, String source, String aggregateId, MessageSent payload) {
        return new EventEnvelope<>(eventId, eventType, version, Instant.now(), source, aggregateId, null, null, payload);
    }

    @Nested
    @DisplayName("valid events")
    class ValidEvents {

        @Test
        @DisplayName("factory-created event passes validation")
        void factoryEventValid() {
            var event = EventFactory.create(MESSAGE);

            assertThat(EventValidator.validate(event).valid()).isTrue();
            assertThat(event.isValid()).isTrue();
        }

        @Test
        @DisplayName("raw JSON payloads only get envelope checks")
        void rawPayload() {
            var raw = EventSerializer.toRaw(EventFactory.create(MESSAGE));

            assertThat(EventValidator.validate(raw).valid()).isTrue();
        }
    }

    @Nested
    @DisplayName("envelope fields")
    class EnvelopeFields {

        @Test
        @DisplayName("reports every missing identity field at once")
        void allErrorsAtOnce() {
            var event = new EventEnvelope<>(null, " ", 0, null, "", null, null, null, MESSAGE);

            var result = EventValidator.validate(event);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors())
                    .anyMatch(e -> e.startsWith("eventId"))
                    .anyMatch(e -> e.startsWith("eventType"))
                    .anyMatch(e -> e.startsWith("version"))
                    .anyMatch(e -> e.startsWith("timestamp"))
                    .anyMatch(e -> e.startsWith("source"))
                    .anyMatch(e -> e.startsWith("aggregateId"));
        }

        @Test
        @DisplayName("null payload fails")
        void nullPayload() {
            var event = envelope("e-1", "MESSAGE_SENT", 2, "MessagingModule", "conv-1", null);

            assertThat(EventValidator.validate(event).errors()).contains("payload must not be null");
        }

        @Test
        @DisplayName("null event fails without throwing")
        void nullEvent() {
            assertThat(EventValidator.validate(null).valid()).isFalse();
        }
    }

    @Nested
    @DisplayName("payload consistency")
    class PayloadConsistency {

        @Test
        @DisplayName("type tag must match the payload variant")
        void typeMismatch() {
            var event = envelope("e-1", "CALL_ENDED", 2, "MessagingModule", "conv-1", MESSAGE);

            assertThat(EventValidator.validate(event).errors())
                    .anyMatch(e -> e.contains("does not match eventType"));
        }

        @Test
        @DisplayName("version must match the payload shape")
        void versionMismatch() {
            var event = envelope("e-1", "MESSAGE_SENT", 1, "MessagingModule", "conv-1", MESSAGE);

            assertThat(EventValidator.validate(event).errors())
                    .anyMatch(e -> e.contains("schema version 2"));
        }

        @Test
        @DisplayName("aggregateId must be the payload's aggregate")
        void aggregateMismatch() {
            var event = envelope("e-1", "MESSAGE_SENT", 2, "MessagingModule", "conv-2", MESSAGE);

            assertThat(EventValidator.validate(event).errors())
                    .anyMatch(e -> e.startsWith("aggregateId does not match"));
        }

        @Test
        @DisplayName("payload required fields are prefixed with payload.")
        void payloadFields() {
            var event = EventFactory.create(new MessageSent(" ", "conv-1", null, null, "TEXT", null, null));

            assertThat(EventValidator.validate(event).errors())
                    .contains("payload.messageId must not be null or blank",
                            "payload.senderId must not be null or blank",
                            "payload.content must not be null");
        }

        @Test
        @DisplayName("aggregate-specific rules apply")
        void aggregateRules() {
            assertThat(EventFactory.create(new UserBlocked("b-1", "alice", "alice", null)).isValid()).isFalse();
            assertThat(EventFactory.create(new CallEnded("c-1", "alice", -1, "FAILED")).isValid()).isFalse();
        }
    }

    @Nested
    @DisplayName("requireValid()")
    class RequireValid {

        @Test
        @DisplayName("throws InvalidEventException carrying every error")
        void throwsWithErrors() {
            var event = EventFactory.create(new MessageSent(null, "conv-1", null, null, "TEXT", "x", null));

            assertThatThrownBy(() -> EventValidator.requireValid(event))
                    .isInstanceOfSatisfying(InvalidEventException.class, e -> {
                        assertThat(e.eventId()).isEqualTo(event.eventId());
                        assertThat(e.errors()).hasSize(2);
                    });
        }

        @Test
        @DisplayName("passes silently for a valid event")
        void validPasses() {
            EventValidator.requireValid(EventFactory.create(MESSAGE));
        }
    }
}
