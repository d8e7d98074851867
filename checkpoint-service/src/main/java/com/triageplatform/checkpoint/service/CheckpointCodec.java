package com.triageplatform.checkpoint.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.triageplatform.common.exception.StoreUnavailableException;
import com.triageplatform.common.exception.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON mapping of checkpoint documents. A payload that cannot be written is caller
 * error; a stored document that cannot be read is a store fault.
 */
public class CheckpointCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public CheckpointCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Map<String, Object> document) {
        try {
            return objectMapper.writeValueAsString(document == null ? Map.of() : document);
        } catch (JsonProcessingException e) {
            throw new ValidationException("CheckpointCodec", "payload is not serialisable: " + e.getOriginalMessage());
        }
    }

    public Map<String, Object> read(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("CheckpointCodec", "stored document is corrupt", e);
        }
    }

    /** Converts an arbitrary value (record, list, map) into its JSON tree as plain maps and lists. */
    public Map<String, Object> toDocument(Object value) {
        return objectMapper.convertValue(value, MAP_TYPE);
    }
}
