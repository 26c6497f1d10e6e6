package com.flagship.points_ledger.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Converts record documents to and from the JSON payloads held by the store.
 */
@Component
public class DocumentMapper {

    private final ObjectMapper objectMapper;

    public DocumentMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Object document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                "Failed to serialize " + document.getClass().getSimpleName(), e);
        }
    }

    public <T> T read(VersionedItem item, Class<T> type) {
        try {
            return objectMapper.readValue(item.getPayload(), type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                "Corrupt " + type.getSimpleName() + " payload at " + item.getKey(), e);
        }
    }

    /**
     * Reads a document held outside the store, such as a cached copy.
     */
    public <T> T read(String payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt " + type.getSimpleName() + " payload", e);
        }
    }
}
