package com.murmur.eventmodel.payload;

import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventType;
import java.util.List;

/** An attachment finished uploading and is ready to be referenced from a message. */
public record MediaUploaded(
        String mediaId, String uploaderId, String conversationId, String mimeType, long sizeBytes)
        implements EventPayload {

    @Override
    public EventType type() {
        return EventType.MEDIA_UPLOADED;
    }

    @Override
    public String aggregateId() {
        return mediaId;
    }

    @Override
    public List<String> validate() {
        List<String> errors = EventPayload.requireNonBlank(
                "mediaId", mediaId,
                "uploaderId", uploaderId,
                "mimeType", mimeType);
        if (sizeBytes <= 0) {
            errors.add("sizeBytes must be positive");
        }
        return errors;
    }
}
