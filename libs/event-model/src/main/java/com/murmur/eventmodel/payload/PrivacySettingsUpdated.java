package com.murmur.eventmodel.payload;

import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventType;
import java.util.List;
import java.util.Map;

/**
 * A user changed one or more privacy settings.
 *
 * @param settings changed settings only, e.g. {@code lastSeen -> CONTACTS}
 */
public record PrivacySettingsUpdated(String userId, Map<String, String> settings) implements EventPayload {

    public PrivacySettingsUpdated {
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    @Override
    public EventType type() {
        return EventType.PRIVACY_SETTINGS_UPDATED;
    }

    @Override
    public String aggregateId() {
        return userId;
    }

    @Override
    public List<String> validate() {
        List<String> errors = EventPayload.requireNonBlank("userId", userId);
        if (settings.isEmpty()) {
            errors.add("settings must not be empty");
        }
        return errors;
    }
}
