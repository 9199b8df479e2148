package com.murmur.eventmodel.versioning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.murmur.eventmodel.EventFactory;
import com.murmur.eventmodel.EventSerializer;
import com.murmur.eventmodel.payload.UserBlocked;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EventVersioningRegistry")
class EventVersioningRegistryTest {

    private final EventVersioningRegistry registry = DefaultEventVersions.registry();

    @Test
    @DisplayName("types without a strategy are version 1 only")
    void unregisteredType() {
        var raw = EventSerializer.toRaw(EventFactory.create(new UserBlocked("b-1", "alice", "bob", null)));

        assertThat(registry.currentVersion("USER_BLOCKED")).isEqualTo(1);
        assertThat(registry.adapt(raw, 1)).isSameAs(raw);
        assertThatThrownBy(() -> registry.adapt(raw, 2))
                .isInstanceOfSatisfying(VersionGapException.class,
                        e -> assertThat(e.missingHopFrom()).isEqualTo(1));
    }

    @Test
    @DisplayName("exposes registered strategies")
    void strategies() {
        assertThat(registry.strategyFor("MESSAGE_SENT")).isPresent();
        assertThat(registry.strategyFor("MEDIA_UPLOADED")).isEmpty();
        assertThat(registry.currentVersion("CALL_ENDED")).isEqualTo(2);
    }

    @Test
    @DisplayName("a type can be registered once")
    void duplicateRegistration() {
        assertThatThrownBy(() -> EventVersioningRegistry.builder()
                        .register(DefaultEventVersions.messageSent())
                        .register(DefaultEventVersions.messageSent()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("empty registry treats every type as version 1")
    void empty() {
        assertThat(EventVersioningRegistry.empty().currentVersion("MESSAGE_SENT")).isEqualTo(1);
    }
}
